package com.jsprinter.json;

/**
 * Thrown when reading an AST or writing a node or document fails.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
