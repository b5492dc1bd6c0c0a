package com.wikisqldump;

import java.util.Objects;

/**
 * One decoded value of a VALUES tuple.
 * <p>
 * Numbers keep their literal source text: some numeric-looking dump fields
 * are fixed-width hashes or bit fields that must round-trip exactly.
 */
public record FieldToken(Kind kind, String text) {

    public enum Kind {
        STRING,
        NUMBER,
        NULL
    }

    private static final FieldToken NULL_TOKEN = new FieldToken(Kind.NULL, null);

    public FieldToken {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.NULL && text != null) {
            throw new IllegalArgumentException("NULL token cannot carry text");
        }
        if (kind != Kind.NULL && text == null) {
            throw new IllegalArgumentException(kind + " token requires text");
        }
    }

    public static FieldToken string(String value) {
        return new FieldToken(Kind.STRING, value);
    }

    public static FieldToken number(String literal) {
        return new FieldToken(Kind.NUMBER, literal);
    }

    public static FieldToken nullValue() {
        return NULL_TOKEN;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * Re-encodes this token the way mysqldump writes it inside a VALUES list.
     */
    public String toSqlLiteral() {
        if (kind == Kind.NULL) {
            return "NULL";
        }
        if (kind == Kind.NUMBER) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length() + 2).append('\'');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\0' -> sb.append("\\0");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case 26 -> sb.append("\\Z");
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '"' -> sb.append("\\\"");
                default -> sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }
}
