package org.pragmatica.scad.error;

/**
 * Thrown only when the library is used incorrectly, never for malformed input.
 */
public class ParserException extends RuntimeException {

    public ParserException(String message) {
        super(message);
    }

    public ParserException(String message, Throwable cause) {
        super(message, cause);
    }
}
