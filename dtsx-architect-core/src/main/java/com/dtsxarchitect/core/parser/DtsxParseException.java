package com.dtsxarchitect.core.parser;

/**
 * Thrown when a package document cannot be read or is not well-formed XML.
 *
 * <p>This is the only fatal parse failure. Missing attributes, unknown task kinds and
 * unresolved references never raise it.
 */
public class DtsxParseException extends RuntimeException {

    public DtsxParseException(String message) {
        super(message);
    }

    public DtsxParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
