package com.wikisqldump;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.extern.java.Log;

/**
 * Finds INSERT statements for one table in a dump and yields their tuples
 * one at a time.
 * <p>
 * Statement headers are recognized at the start of a line or right after
 * the ';' of the previous statement on the same line. Everything else
 * (DDL, comments, LOCK TABLES, blank lines) is skipped line by line. Inside a
 * VALUES list the scanner tracks quotes and escapes only to find tuple
 * boundaries; decoding is left to {@link ValueTokenizer}. Only the tuple
 * being returned is held in memory.
 */
@Log
public class DumpStatementScanner {

    private static final String INSERT_INTO = "INSERT INTO";
    private static final String VALUES = "VALUES";
    private static final int MAX_HEADER_LENGTH = 64 * 1024;
    private static final Pattern INSERT_HEADER = Pattern.compile(
            "^\\s*INSERT\\s+INTO\\s+(`[^`]+`|[^\\s(`]+)\\s*(?:\\((.*)\\))?\\s*VALUES$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final Reader reader;
    private final TableSchema schema;
    private final int maxStatements;

    private final char[] buffer = new char[8192];
    private int bufferPos;
    private int bufferLimit;

    private final StringBuilder header = new StringBuilder();
    private final StringBuilder tuple = new StringBuilder();

    private boolean inStatement;
    private boolean expectTuple;
    private boolean restOfLinePending;
    private long statementNumber;
    private long targetStatements;
    private long skippedStatements;
    private long tupleInStatement;
    private long rowIndex;
    private long lineNumber = 1;
    private long charsConsumed;
    private int peakTupleLength;
    private boolean statementLimitReached;

    /**
     * @param reader        decompressed dump text, not closed by the scanner
     * @param schema        target table; statements for other tables are skipped
     * @param maxStatements stop after this many target INSERT statements, 0 for no limit
     */
    public DumpStatementScanner(Reader reader, TableSchema schema, int maxStatements) {
        this.reader = reader;
        this.schema = schema;
        this.maxStatements = maxStatements;
    }

    /**
     * Tuples of the target table in dump order. Iteration ends at the end of
     * input or once the statement limit is reached. Read errors surface as
     * {@link UncheckedIOException}.
     */
    public Iterable<RawTuple> tuples() {
        return () -> new Iterator<>() {
            private RawTuple nextTuple;

            {
                advance();
            }

            @Override
            public boolean hasNext() {
                return nextTuple != null;
            }

            @Override
            public RawTuple next() {
                if (nextTuple == null) {
                    throw new NoSuchElementException();
                }
                RawTuple result = nextTuple;
                advance();
                return result;
            }

            private void advance() {
                try {
                    nextTuple = readNextTuple();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
        };
    }

    private RawTuple readNextTuple() throws IOException {
        while (true) {
            if (!inStatement) {
                if (maxStatements > 0 && targetStatements >= maxStatements) {
                    statementLimitReached = true;
                    return null;
                }
                String table = openNextStatement();
                if (table == null) {
                    return null;
                }
                if (!schema.name().equals(table)) {
                    skippedStatements++;
                    log.fine(() -> "Skipping INSERT statement for table " + table + " on line " + lineNumber);
                    skipStatementBody();
                    continue;
                }
                targetStatements++;
                tupleInStatement = 0;
                inStatement = true;
                expectTuple = true;
            }

            int c = skipWhitespace();
            if (c == -1) {
                throw new MalformedTupleException("Dump ends inside INSERT statement " + statementNumber
                        + " after tuple " + tupleInStatement + " (truncated download?)");
            }
            if (expectTuple) {
                if (c != '(') {
                    throw unexpected(c, "'('");
                }
                String text = readTupleBody();
                expectTuple = false;
                tupleInStatement++;
                rowIndex++;
                return new RawTuple(schema.name(), statementNumber, tupleInStatement, rowIndex, text);
            }
            if (c == ',') {
                expectTuple = true;
            } else if (c == ';') {
                inStatement = false;
                endStatement();
            } else {
                throw unexpected(c, "',' or ';'");
            }
        }
    }

    /**
     * Reads lines until one opens an INSERT statement and consumes its header
     * up to and including the VALUES keyword.
     *
     * @return the table name, or {@code null} at end of input
     */
    private String openNextStatement() throws IOException {
        while (true) {
            boolean afterStatement = restOfLinePending;
            restOfLinePending = false;
            int c = read();
            while (c == ' ' || c == '\t' || (c == '\uFEFF' && charsConsumed == 1)) {
                c = read();
            }
            if (c == -1) {
                return null;
            }
            header.setLength(0);
            boolean inIdentifier = false;
            while (c != -1 && c != '\n') {
                header.append((char) c);
                int len = header.length();
                if (len <= INSERT_INTO.length()) {
                    if (Character.toUpperCase((char) c) != INSERT_INTO.charAt(len - 1)) {
                        if (afterStatement) {
                            throw new MalformedTupleException("Expected end of line or another INSERT statement"
                                    + " after ';' on line " + lineNumber + " but found '" + header + "'");
                        }
                        skipLine();
                        break;
                    }
                } else {
                    if (c == '`') {
                        inIdentifier = !inIdentifier;
                    } else if (!inIdentifier && endsWithValuesKeyword()) {
                        String table = parseHeader();
                        if (table != null) {
                            return table;
                        }
                    }
                    if (len > MAX_HEADER_LENGTH) {
                        throw new MalformedTupleException("INSERT header on line " + lineNumber
                                + " exceeds " + MAX_HEADER_LENGTH + " characters without VALUES");
                    }
                }
                c = read();
            }
            if (header.length() > INSERT_INTO.length()) {
                throw new MalformedTupleException("INSERT statement without VALUES on line " + lineNumber);
            }
        }
    }

    private boolean endsWithValuesKeyword() {
        int start = header.length() - VALUES.length();
        if (start <= INSERT_INTO.length()) {
            return false;
        }
        for (int i = 0; i < VALUES.length(); i++) {
            if (Character.toUpperCase(header.charAt(start + i)) != VALUES.charAt(i)) {
                return false;
            }
        }
        char before = header.charAt(start - 1);
        return Character.isWhitespace(before) || before == ')' || before == '`';
    }

    /**
     * @return the table name, or {@code null} if the header read so far only
     *         looked like it ended at VALUES
     */
    private String parseHeader() {
        Matcher matcher = INSERT_HEADER.matcher(header);
        if (!matcher.matches()) {
            return null;
        }
        statementNumber++;
        String table = matcher.group(1).replace("`", "");
        String columnList = matcher.group(2);
        if (columnList != null && schema.name().equals(table)) {
            List<String> declared = Arrays.stream(columnList.split(","))
                    .map(col -> col.trim().replaceAll("[`'\"]", ""))
                    .toList();
            if (!declared.equals(schema.columns())) {
                throw new SchemaMismatchException("INSERT statement " + statementNumber + " declares columns "
                        + declared + " but table " + table + " has " + schema.columns());
            }
        }
        return table;
    }

    private String readTupleBody() throws IOException {
        tuple.setLength(0);
        int depth = 1;
        boolean inQuote = false;
        boolean escapeNext = false;
        while (true) {
            int c = read();
            if (c == -1) {
                throw new MalformedTupleException("Dump ends inside tuple " + (tupleInStatement + 1)
                        + " of INSERT statement " + statementNumber + " (truncated download?)");
            }
            if (escapeNext) {
                escapeNext = false;
            } else if (inQuote) {
                if (c == '\\') {
                    escapeNext = true;
                } else if (c == '\'') {
                    inQuote = false;
                }
            } else if (c == '\'') {
                inQuote = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                break;
            }
            tuple.append((char) c);
        }
        peakTupleLength = Math.max(peakTupleLength, tuple.length());
        return tuple.toString();
    }

    /**
     * Consumes the rest of a statement for another table without buffering it.
     */
    private void skipStatementBody() throws IOException {
        int depth = 0;
        boolean inQuote = false;
        boolean escapeNext = false;
        while (true) {
            int c = read();
            if (c == -1) {
                throw new MalformedTupleException("Dump ends inside INSERT statement " + statementNumber
                        + " (truncated download?)");
            }
            if (escapeNext) {
                escapeNext = false;
            } else if (inQuote) {
                if (c == '\\') {
                    escapeNext = true;
                } else if (c == '\'') {
                    inQuote = false;
                }
            } else if (c == '\'') {
                inQuote = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ';' && depth == 0) {
                endStatement();
                return;
            }
        }
    }

    private MalformedTupleException unexpected(int c, String expected) {
        return new MalformedTupleException("Expected " + expected + " but found '" + (char) c
                + "' on line " + lineNumber + " in INSERT statement " + statementNumber
                + " after tuple " + tupleInStatement);
    }

    private int skipWhitespace() throws IOException {
        int c = read();
        while (c != -1 && Character.isWhitespace(c)) {
            c = read();
        }
        return c;
    }

    /**
     * Consumes trailing whitespace after a statement's ';'. Anything else on
     * the same line is left for {@link #openNextStatement()}, which only
     * accepts another INSERT there.
     */
    private void endStatement() throws IOException {
        int c = read();
        while (c != -1 && c != '\n' && Character.isWhitespace(c)) {
            c = read();
        }
        if (c != -1 && c != '\n') {
            unread();
            restOfLinePending = true;
        }
    }

    private void skipLine() throws IOException {
        int c = read();
        while (c != -1 && c != '\n') {
            c = read();
        }
    }

    private int read() throws IOException {
        if (bufferPos == bufferLimit) {
            int n = reader.read(buffer, 0, buffer.length);
            if (n <= 0) {
                return -1;
            }
            bufferPos = 0;
            bufferLimit = n;
        }
        char c = buffer[bufferPos++];
        charsConsumed++;
        if (c == '\n') {
            lineNumber++;
        }
        return c;
    }

    /**
     * Steps back over the character just returned by {@link #read()}, which is
     * always still in the buffer.
     */
    private void unread() {
        bufferPos--;
        charsConsumed--;
        if (buffer[bufferPos] == '\n') {
            lineNumber--;
        }
    }

    public long statementCount() {
        return targetStatements;
    }

    public long skippedStatementCount() {
        return skippedStatements;
    }

    public long charsConsumed() {
        return charsConsumed;
    }

    /**
     * @return the longest tuple, in characters, that was ever buffered
     */
    public int peakTupleLength() {
        return peakTupleLength;
    }

    public boolean statementLimitReached() {
        return statementLimitReached;
    }
}
