package com.telereplay.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Explicit row layout built once from the column list returned by the archive.
 * <p>
 * The archive stores array fields as one column per element ({@code force0},
 * {@code force1}, ...). A column ending in {@code 0} opens an array named by the
 * column without that digit; the columns that follow and consist of the same
 * prefix plus an index become its elements. Everything else is a scalar field.
 */
public final class RowSchema {
    private static final Logger LOG = LoggerFactory.getLogger(RowSchema.class);
    private static final int MAX_INDEX_DIGITS = 6;

    private final List<String> columns;
    private final int timeColumn;
    private final List<FieldDescriptor> fields;

    private RowSchema(List<String> columns, int timeColumn, List<FieldDescriptor> fields) {
        this.columns = List.copyOf(columns);
        this.timeColumn = timeColumn;
        this.fields = List.copyOf(fields);
    }

    /**
     * Build a schema from archive columns.
     *
     * @param columns    Column names in archive order
     * @param timeColumn Name of the timestamp column, which is not a field
     */
    public static RowSchema fromColumns(List<String> columns, String timeColumn) {
        int timeIndex = columns.indexOf(timeColumn);
        if (timeIndex < 0) {
            throw new IllegalArgumentException("Missing time column '" + timeColumn + "' in " + columns);
        }

        List<FieldDescriptor> fields = new ArrayList<>();
        String arrayName = null;
        TreeMap<Integer, Integer> elements = new TreeMap<>();

        for (int i = 0; i < columns.size(); i++) {
            if (i == timeIndex) continue;
            String column = columns.get(i);

            if (arrayName != null && column.startsWith(arrayName)) {
                String suffix = column.substring(arrayName.length());
                if (isIndex(suffix)) {
                    elements.put(Integer.parseInt(suffix), i);
                    continue;
                }
            }

            if (arrayName != null) {
                fields.add(array(arrayName, elements));
                arrayName = null;
            }

            if (column.length() > 1 && column.endsWith("0")) {
                arrayName = column.substring(0, column.length() - 1);
                elements = new TreeMap<>();
                elements.put(0, i);
            } else {
                fields.add(FieldDescriptor.scalar(column, i));
            }
        }

        if (arrayName != null) {
            fields.add(array(arrayName, elements));
        }

        return new RowSchema(columns, timeIndex, fields);
    }

    private static boolean isIndex(String suffix) {
        if (suffix.isEmpty() || suffix.length() > MAX_INDEX_DIGITS) return false;
        for (int i = 0; i < suffix.length(); i++) {
            if (!Character.isDigit(suffix.charAt(i))) return false;
        }
        return true;
    }

    private static FieldDescriptor array(String name, TreeMap<Integer, Integer> elements) {
        int length = elements.lastKey() + 1;
        List<Integer> positions = new ArrayList<>(length);
        for (int index = 0; index < length; index++) {
            positions.add(elements.getOrDefault(index, -1));
        }
        FieldDescriptor field = new FieldDescriptor(name, true, positions);
        if (!field.isComplete()) {
            LOG.warn("Incomplete array in archive data - {} has elements {} of {}",
                name, elements.keySet(), length);
        }
        return field;
    }

    /**
     * Assemble a row from one archive record.
     *
     * @param timestamp Parsed value of the time column
     * @param values    Raw values in column order
     */
    public Row toRow(Instant timestamp, List<?> values) {
        if (values.size() != columns.size()) {
            throw new IllegalArgumentException("Expected " + columns.size() + " values, got " + values.size());
        }
        Map<String, Object> fieldValues = new LinkedHashMap<>();
        for (FieldDescriptor field : fields) {
            if (field.array()) {
                List<Object> elements = new ArrayList<>(field.length());
                for (int column : field.columns()) {
                    elements.add(column < 0 ? null : values.get(column));
                }
                fieldValues.put(field.name(), Collections.unmodifiableList(elements));
            } else {
                fieldValues.put(field.name(), values.get(field.columns().get(0)));
            }
        }
        return new Row(timestamp, fieldValues);
    }

    public List<String> getColumns() {
        return columns;
    }

    public int getTimeColumn() {
        return timeColumn;
    }

    public List<FieldDescriptor> getFields() {
        return fields;
    }

    public List<String> getFieldNames() {
        return fields.stream().map(FieldDescriptor::name).toList();
    }
}
