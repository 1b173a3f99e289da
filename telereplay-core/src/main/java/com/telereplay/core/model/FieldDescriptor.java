package com.telereplay.core.model;

import java.util.List;

/**
 * Describes one named field of a row and the archive columns it is read from.
 *
 * @param name    Field name. For arrays this is the column name without the index suffix.
 * @param array   True when the field is assembled from indexed columns (name0, name1, ...)
 * @param columns Column positions. A single entry for scalars; one entry per element
 *                for arrays, -1 marking an element the archive did not return.
 */
public record FieldDescriptor(String name, boolean array, List<Integer> columns) {

    public FieldDescriptor {
        columns = List.copyOf(columns);
        if (!array && columns.size() != 1) {
            throw new IllegalArgumentException("Scalar field " + name + " must map to exactly one column");
        }
    }

    public static FieldDescriptor scalar(String name, int column) {
        return new FieldDescriptor(name, false, List.of(column));
    }

    /**
     * Number of elements, or 1 for a scalar.
     */
    public int length() {
        return columns.size();
    }

    public boolean isComplete() {
        return !columns.contains(-1);
    }
}
