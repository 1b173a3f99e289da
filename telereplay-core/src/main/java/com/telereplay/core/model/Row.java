package com.telereplay.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One archived sample of a topic: a timestamp and its named field values.
 * <p>
 * Values are Double, Long, Boolean, String, null, or an unmodifiable
 * {@code List<Object>} for array fields. Field order is the schema order.
 */
public record Row(Instant timestamp, Map<String, Object> values) {

    public Row {
        Objects.requireNonNull(timestamp, "timestamp");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    public Object get(String field) {
        return values.get(field);
    }

    public double getDouble(String field) {
        Object value = require(field);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException("Field " + field + " is not numeric: " + value);
    }

    public long getLong(String field) {
        Object value = require(field);
        if (value instanceof Number n) {
            return n.longValue();
        }
        throw new IllegalArgumentException("Field " + field + " is not numeric: " + value);
    }

    public boolean getBoolean(String field) {
        Object value = require(field);
        if (value instanceof Boolean b) {
            return b;
        }
        throw new IllegalArgumentException("Field " + field + " is not boolean: " + value);
    }

    public String getString(String field) {
        Object value = values.get(field);
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    public List<Object> getArray(String field) {
        Object value = require(field);
        if (value instanceof List<?> list) {
            return (List<Object>) list;
        }
        throw new IllegalArgumentException("Field " + field + " is not an array: " + value);
    }

    private Object require(String field) {
        Object value = values.get(field);
        if (value == null) {
            throw new IllegalArgumentException("No value for field " + field + " at " + timestamp);
        }
        return value;
    }
}
