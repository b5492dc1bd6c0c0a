package com.wikisqldump;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a {@link FilterSpec} from YAML:
 *
 * <pre>
 * keep_column_names: [page_id, page_title]
 * allowlists:
 *   page_namespace: [0]
 * blocklists:
 *   page_is_redirect: [1]
 * </pre>
 *
 * Scalars are read as their string form, so {@code 0} and {@code "0"} are
 * the same filter value.
 */
public final class FilterSpecLoader {

    private static final Set<String> KEYS = Set.of("keep_column_names", "drop_column_names", "allowlists",
            "blocklists");

    private FilterSpecLoader() {}

    public static FilterSpec load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        }
    }

    public static FilterSpec load(InputStream in, String source) {
        Object document;
        try {
            document = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        } catch (YAMLException e) {
            throw new ConfigurationException("Cannot parse filter file " + source + ": " + e.getMessage(), e);
        }
        if (document == null) {
            return FilterSpec.none();
        }
        if (!(document instanceof Map<?, ?> root)) {
            throw new ConfigurationException("Filter file " + source + " must contain a mapping");
        }
        for (Object key : root.keySet()) {
            if (!KEYS.contains(String.valueOf(key))) {
                throw new ConfigurationException("Unknown key " + key + " in filter file " + source
                        + ", expected one of " + KEYS);
            }
        }
        return new FilterSpec(
                stringList(root.get("keep_column_names"), "keep_column_names", source),
                stringList(root.get("drop_column_names"), "drop_column_names", source),
                valueLists(root.get("allowlists"), "allowlists", source),
                valueLists(root.get("blocklists"), "blocklists", source));
    }

    private static List<String> stringList(Object node, String key, String source) {
        if (node == null) {
            return List.of();
        }
        if (!(node instanceof List<?> items)) {
            throw new ConfigurationException(key + " in filter file " + source + " must be a list");
        }
        List<String> values = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item == null) {
                throw new ConfigurationException(key + " in filter file " + source + " contains an empty entry");
            }
            values.add(String.valueOf(item));
        }
        return values;
    }

    private static Map<String, Set<String>> valueLists(Object node, String key, String source) {
        if (node == null) {
            return Map.of();
        }
        if (!(node instanceof Map<?, ?> columns)) {
            throw new ConfigurationException(key + " in filter file " + source + " must map column names to lists");
        }
        Map<String, Set<String>> lists = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : columns.entrySet()) {
            String column = String.valueOf(entry.getKey());
            lists.put(column, new LinkedHashSet<>(stringList(entry.getValue(), key + "." + column, source)));
        }
        return lists;
    }
}
