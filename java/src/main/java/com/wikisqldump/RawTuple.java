package com.wikisqldump;

/**
 * Source text between a matching pair of parentheses in a VALUES list.
 *
 * @param tableName        table named by the enclosing INSERT statement
 * @param statementNumber  1-based INSERT statement counter
 * @param tupleInStatement 1-based position within the statement
 * @param rowIndex         1-based position across the whole dump
 * @param text             tuple interior, without the parentheses
 */
public record RawTuple(
        String tableName,
        long statementNumber,
        long tupleInStatement,
        long rowIndex,
        String text) {
}
