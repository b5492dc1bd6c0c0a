package com.wikisqldump;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the interior of one {@code (...)} tuple into {@link FieldToken}s.
 * <p>
 * Only backslash escapes are honored inside quoted values, as mysqldump
 * writes them. SQL-standard quote doubling ({@code ''}) is not an escape, so
 * {@code 'O''Brien'} is rejected rather than silently decoded.
 * <p>
 * Instances hold no state and may be shared between threads.
 */
public class ValueTokenizer {

    private static final String NULL_LITERAL = "NULL";

    public List<FieldToken> tokenize(CharSequence span) {
        List<FieldToken> fields = new ArrayList<>();
        int len = span.length();
        int i = skipWhitespace(span, 0);
        if (i == len) {
            return fields;
        }
        while (true) {
            i = skipWhitespace(span, i);
            if (i == len) {
                throw new MalformedTupleException("Empty value after trailing comma", span, i);
            }
            if (span.charAt(i) == '\'') {
                i = readQuoted(span, i + 1, fields);
            } else {
                i = readUnquoted(span, i, fields);
            }
            i = skipWhitespace(span, i);
            if (i == len) {
                return fields;
            }
            if (span.charAt(i) != ',') {
                throw new MalformedTupleException("Expected ',' between values but found '" + span.charAt(i) + "'",
                        span, i);
            }
            i++;
        }
    }

    private int readQuoted(CharSequence span, int start, List<FieldToken> fields) {
        StringBuilder value = new StringBuilder();
        int len = span.length();
        for (int j = start; j < len; j++) {
            char c = span.charAt(j);
            if (c == '\\') {
                if (j + 1 == len) {
                    throw new MalformedTupleException("Escape pending at end of tuple", span, j);
                }
                value.append(unescape(span.charAt(++j)));
            } else if (c == '\'') {
                fields.add(FieldToken.string(value.toString()));
                return j + 1;
            } else {
                value.append(c);
            }
        }
        throw new MalformedTupleException("Unterminated quoted value", span, start - 1);
    }

    private int readUnquoted(CharSequence span, int start, List<FieldToken> fields) {
        int len = span.length();
        int j = start;
        while (j < len && span.charAt(j) != ',') {
            if (span.charAt(j) == '\'') {
                throw new MalformedTupleException("Unexpected quote inside unquoted value", span, j);
            }
            j++;
        }
        String literal = span.subSequence(start, j).toString().trim();
        if (literal.isEmpty()) {
            throw new MalformedTupleException("Empty value", span, start);
        }
        fields.add(NULL_LITERAL.equals(literal) ? FieldToken.nullValue() : FieldToken.number(literal));
        return j;
    }

    static char unescape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case '0' -> '\0';
            case 'Z' -> (char) 26;
            // \' \" \\ and anything unknown map to the character itself
            default -> c;
        };
    }

    private static int skipWhitespace(CharSequence span, int i) {
        while (i < span.length() && Character.isWhitespace(span.charAt(i))) {
            i++;
        }
        return i;
    }
}
