package com.wikisqldump;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes rows as RFC 4180 CSV with {@code \n} line endings.
 * <p>
 * A cell is quoted when it contains a comma, a double quote, CR or LF, and
 * embedded quotes are doubled. SQL NULL is an empty unquoted cell while an
 * empty string is written as {@code ""}, so the two stay apart when read
 * back. Other text, including {@code NaN}, {@code Null} or {@code NULL},
 * is written exactly as decoded.
 */
public class CsvRowWriter {

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';
    private static final char RECORD_SEPARATOR = '\n';

    private final Writer out;
    private final StringBuilder line = new StringBuilder(256);

    /**
     * @param out destination; buffering and closing are left to the caller
     */
    public CsvRowWriter(Writer out) {
        this.out = out;
    }

    public void writeHeader(List<String> columns) throws IOException {
        writeLine(columns);
    }

    public void writeRecord(OutputRecord record) throws IOException {
        writeLine(record.cells());
    }

    public void flush() throws IOException {
        out.flush();
    }

    // the whole line is built first so a row is never half written
    private void writeLine(List<String> cells) throws IOException {
        line.setLength(0);
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                line.append(DELIMITER);
            }
            appendCell(line, cells.get(i));
        }
        line.append(RECORD_SEPARATOR);
        out.append(line);
    }

    public static String encodeCell(String value) {
        StringBuilder sb = new StringBuilder();
        appendCell(sb, value);
        return sb.toString();
    }

    private static void appendCell(StringBuilder sb, String value) {
        if (value == null) {
            return;
        }
        if (value.isEmpty()) {
            sb.append(QUOTE).append(QUOTE);
            return;
        }
        if (!needsQuotes(value)) {
            sb.append(value);
            return;
        }
        sb.append(QUOTE);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == QUOTE) {
                sb.append(QUOTE);
            }
            sb.append(c);
        }
        sb.append(QUOTE);
    }

    private static boolean needsQuotes(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == DELIMITER || c == QUOTE || c == '\n' || c == '\r') {
                return true;
            }
        }
        return false;
    }
}
