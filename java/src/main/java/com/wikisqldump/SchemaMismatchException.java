package com.wikisqldump;

/**
 * Raised when a tuple does not line up with the table's column schema.
 */
public class SchemaMismatchException extends DumpConversionException {

    private final long rowIndex;
    private final String rawTuple;

    public SchemaMismatchException(String message) {
        super(message);
        this.rowIndex = -1;
        this.rawTuple = null;
    }

    public SchemaMismatchException(String tableName, long rowIndex, int expected, int actual, String rawTuple) {
        super(String.format("Row %d of table %s has %d fields but the schema defines %d columns: %s",
                rowIndex, tableName, actual, expected, MalformedTupleException.snippet(rawTuple)));
        this.rowIndex = rowIndex;
        this.rawTuple = rawTuple;
    }

    /**
     * @return 1-based index of the offending tuple in the dump, or -1 when
     *         the mismatch was found in a statement header
     */
    public long rowIndex() {
        return rowIndex;
    }

    public String rawTuple() {
        return rawTuple;
    }
}
