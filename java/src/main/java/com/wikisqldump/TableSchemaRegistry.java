package com.wikisqldump;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Read-only table name to {@link TableSchema} lookup.
 * <p>
 * The built-in definitions live in {@code table-schemas.yml} on the
 * classpath and follow the MediaWiki table layouts of the SQL dumps.
 */
public final class TableSchemaRegistry {

    static final String DEFAULT_RESOURCE = "/table-schemas.yml";

    private final Map<String, TableSchema> schemas;

    private TableSchemaRegistry(Map<String, TableSchema> schemas) {
        this.schemas = Collections.unmodifiableMap(schemas);
    }

    public static TableSchemaRegistry loadDefault() throws IOException {
        try (InputStream in = TableSchemaRegistry.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Schema resource " + DEFAULT_RESOURCE + " not found on classpath");
            }
            return load(in);
        }
    }

    public static TableSchemaRegistry load(InputStream in) {
        Yaml yaml = new Yaml(new Constructor(TableSchemasFile.class, new LoaderOptions()));
        TableSchemasFile file = yaml.load(in);
        Map<String, TableSchema> schemas = new LinkedHashMap<>();
        if (file != null) {
            for (Map.Entry<String, List<String>> table : file.getTables().entrySet()) {
                schemas.put(table.getKey(), new TableSchema(table.getKey(), table.getValue()));
            }
        }
        return new TableSchemaRegistry(schemas);
    }

    /**
     * @throws UnsupportedTableException if no schema is registered for the table
     */
    public TableSchema lookup(String tableName) {
        TableSchema schema = schemas.get(tableName);
        if (schema == null) {
            throw new UnsupportedTableException(tableName, schemas.keySet());
        }
        return schema;
    }

    public Set<String> tableNames() {
        return schemas.keySet();
    }
}
