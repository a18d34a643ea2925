package com.pineparser.jackson;

/**
 * Exception thrown when JSON serialization fails or an options document is rejected.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
