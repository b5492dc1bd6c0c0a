package com.wikisqldump;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies a {@link FilterSpec} to assembled rows of one table.
 * <p>
 * Row predicates see the full row, so a filter may reference a column that
 * the projection drops. Retained columns are always written in schema order.
 * A NULL value is compared as the empty string, the same text the CSV
 * output holds for it.
 */
public class RowFilter {

    private final TableSchema schema;
    private final int[] keepIndexes;
    private final List<String> outputColumns;
    private final Map<Integer, Set<String>> allowlists;
    private final Map<Integer, Set<String>> blocklists;

    /**
     * @throws ConfigurationException if the spec is contradictory or names
     *                                columns the table does not have
     */
    public RowFilter(TableSchema schema, FilterSpec spec) {
        this.schema = schema;
        spec.validate();
        checkColumnList(spec.keepColumnNames(), "keep column names");
        checkColumnList(spec.dropColumnNames(), "drop column names");
        this.allowlists = resolve(spec.allowlists(), "allowlists");
        this.blocklists = resolve(spec.blocklists(), "blocklists");

        List<Integer> indexes = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (int i = 0; i < schema.size(); i++) {
            String column = schema.columns().get(i);
            boolean kept = spec.keepColumnNames().isEmpty() || spec.keepColumnNames().contains(column);
            if (kept && !spec.dropColumnNames().contains(column)) {
                indexes.add(i);
                names.add(column);
            }
        }
        if (names.isEmpty()) {
            throw new ConfigurationException("Filter drops every column of table " + schema.name());
        }
        this.keepIndexes = indexes.stream().mapToInt(Integer::intValue).toArray();
        this.outputColumns = List.copyOf(names);
    }

    private void checkColumnList(List<String> columns, String label) {
        Set<String> seen = new HashSet<>();
        for (String column : columns) {
            if (!seen.add(column)) {
                throw new ConfigurationException(label + " include duplicate column " + column);
            }
            requireColumn(column, label);
        }
    }

    private Map<Integer, Set<String>> resolve(Map<String, Set<String>> lists, String label) {
        Map<Integer, Set<String>> byIndex = new LinkedHashMap<>();
        lists.forEach((column, values) -> {
            requireColumn(column, label);
            byIndex.put(schema.indexOf(column), values);
        });
        return byIndex;
    }

    private void requireColumn(String column, String label) {
        if (!schema.hasColumn(column)) {
            throw new ConfigurationException("column name " + column + " in " + label
                    + " is not a valid column of table " + schema.name() + ": " + schema.columns());
        }
    }

    public List<String> outputColumns() {
        return outputColumns;
    }

    public boolean accepts(Row row) {
        for (Map.Entry<Integer, Set<String>> allow : allowlists.entrySet()) {
            if (!allow.getValue().contains(filterValue(row.get(allow.getKey())))) {
                return false;
            }
        }
        for (Map.Entry<Integer, Set<String>> block : blocklists.entrySet()) {
            if (block.getValue().contains(filterValue(row.get(block.getKey())))) {
                return false;
            }
        }
        return true;
    }

    public OutputRecord project(Row row) {
        List<String> cells = new ArrayList<>(keepIndexes.length);
        for (int index : keepIndexes) {
            cells.add(row.get(index).text());
        }
        return new OutputRecord(cells);
    }

    private static String filterValue(FieldToken token) {
        return token.isNull() ? "" : token.text();
    }
}
