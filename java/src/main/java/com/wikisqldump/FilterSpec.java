package com.wikisqldump;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column projection and row filters for one conversion.
 *
 * @param keepColumnNames columns to write, empty to keep all
 * @param dropColumnNames columns to leave out, empty to drop none
 * @param allowlists      column to accepted values; a row is kept only if
 *                        every listed column holds an accepted value
 * @param blocklists      column to rejected values; a row is dropped if any
 *                        listed column holds a rejected value
 */
public record FilterSpec(
        List<String> keepColumnNames,
        List<String> dropColumnNames,
        Map<String, Set<String>> allowlists,
        Map<String, Set<String>> blocklists) {

    private static final FilterSpec NONE = new FilterSpec(null, null, null, null);

    public FilterSpec {
        keepColumnNames = keepColumnNames == null ? List.of() : List.copyOf(keepColumnNames);
        dropColumnNames = dropColumnNames == null ? List.of() : List.copyOf(dropColumnNames);
        allowlists = copyOf(allowlists);
        blocklists = copyOf(blocklists);
    }

    public static FilterSpec none() {
        return NONE;
    }

    /**
     * Checks the rules that do not depend on a table schema.
     *
     * @throws ConfigurationException if both keep and drop lists are given or
     *                                a column has both an allowlist and a
     *                                blocklist
     */
    public FilterSpec validate() {
        if (!keepColumnNames.isEmpty() && !dropColumnNames.isEmpty()) {
            throw new ConfigurationException("keep column names " + keepColumnNames + " and drop column names "
                    + dropColumnNames + " cannot be combined");
        }
        for (String column : allowlists.keySet()) {
            if (blocklists.containsKey(column)) {
                throw new ConfigurationException("column " + column + " has both an allowlist and a blocklist");
            }
        }
        return this;
    }

    /**
     * Combines two specs: column lists are concatenated and value sets of the
     * same column are merged.
     */
    public FilterSpec merge(FilterSpec other) {
        List<String> keep = new ArrayList<>(keepColumnNames);
        keep.addAll(other.keepColumnNames);
        List<String> drop = new ArrayList<>(dropColumnNames);
        drop.addAll(other.dropColumnNames);
        return new FilterSpec(keep, drop, mergeLists(allowlists, other.allowlists),
                mergeLists(blocklists, other.blocklists));
    }

    private static Map<String, Set<String>> mergeLists(Map<String, Set<String>> a, Map<String, Set<String>> b) {
        Map<String, Set<String>> merged = new LinkedHashMap<>();
        a.forEach((column, values) -> merged.computeIfAbsent(column, k -> new LinkedHashSet<>()).addAll(values));
        b.forEach((column, values) -> merged.computeIfAbsent(column, k -> new LinkedHashSet<>()).addAll(values));
        return merged;
    }

    private static Map<String, Set<String>> copyOf(Map<String, Set<String>> lists) {
        if (lists == null) {
            return Map.of();
        }
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        lists.forEach((column, values) -> copy.put(column, Set.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }
}
