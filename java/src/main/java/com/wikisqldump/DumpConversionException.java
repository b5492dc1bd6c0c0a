package com.wikisqldump;

/**
 * Base class for every error that aborts a dump conversion.
 * <p>
 * None of these are recoverable: a conversion either writes every row of the
 * table or stops at the first problem.
 */
public abstract class DumpConversionException extends RuntimeException {

    protected DumpConversionException(String message) {
        super(message);
    }

    protected DumpConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
