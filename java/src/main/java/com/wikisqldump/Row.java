package com.wikisqldump;

import java.util.List;

/**
 * Tokens of one tuple bound to the table's columns by position.
 */
public record Row(TableSchema schema, long rowIndex, List<FieldToken> values) {

    public Row {
        values = List.copyOf(values);
        if (values.size() != schema.size()) {
            throw new IllegalArgumentException("Row has " + values.size() + " values for " + schema.size()
                    + " columns");
        }
    }

    public FieldToken get(int index) {
        return values.get(index);
    }

    public FieldToken get(String column) {
        int index = schema.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column " + column + " in table " + schema.name());
        }
        return values.get(index);
    }
}
