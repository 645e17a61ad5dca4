package com.astlens.json;

/**
 * Exception thrown when JSON serialization or deserialization fails,
 * including input that is valid JSON but not a valid snapshot.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
