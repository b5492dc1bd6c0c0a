package com.wikisqldump;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Counters of a finished conversion.
 */
public record ConversionResult(
        String tableName,
        long statements,
        long skippedStatements,
        long rowsParsed,
        long rowsWritten,
        long rowsFiltered,
        int peakTupleLength,
        long elapsedMs,
        boolean statementLimitReached) {

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public String toJson() {
        return gson.toJson(this);
    }

    public static ConversionResult fromJson(String json) {
        return gson.fromJson(json, ConversionResult.class);
    }
}
