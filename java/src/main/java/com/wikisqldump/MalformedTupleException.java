package com.wikisqldump;

/**
 * Raised when a VALUES tuple cannot be decoded: unterminated quotes, a
 * dangling escape, empty elements, stray characters or a truncated statement.
 */
public class MalformedTupleException extends DumpConversionException {

    private static final int SNIPPET_LENGTH = 120;

    public MalformedTupleException(String message) {
        super(message);
    }

    public MalformedTupleException(String message, Throwable cause) {
        super(message, cause);
    }

    public MalformedTupleException(String message, CharSequence span, int offset) {
        super(message + " at offset " + offset + " of tuple: " + snippet(span));
    }

    static String snippet(CharSequence span) {
        if (span.length() <= SNIPPET_LENGTH) {
            return "(" + span + ")";
        }
        return "(" + span.subSequence(0, SNIPPET_LENGTH) + "...)";
    }
}
