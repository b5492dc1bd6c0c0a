package com.wikisqldump;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered column names of one dump table.
 */
public record TableSchema(String name, List<String> columns) {

    public TableSchema {
        Objects.requireNonNull(name, "name");
        columns = List.copyOf(columns);
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Table " + name + " has no columns");
        }
        Set<String> seen = new HashSet<>();
        for (String column : columns) {
            if (!seen.add(column)) {
                throw new IllegalArgumentException("Table " + name + " declares column " + column + " twice");
            }
        }
    }

    public int size() {
        return columns.size();
    }

    public int indexOf(String column) {
        return columns.indexOf(column);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }
}
