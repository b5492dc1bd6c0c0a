package com.wikisqldump;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML shape of the schema registry: table name to ordered column names.
 */
public class TableSchemasFile {
    private Map<String, List<String>> tables = new LinkedHashMap<>();

    public TableSchemasFile() {
    }

    public Map<String, List<String>> getTables() {
        return tables;
    }

    public void setTables(Map<String, List<String>> tables) {
        this.tables = tables != null ? tables : new LinkedHashMap<>();
    }
}
