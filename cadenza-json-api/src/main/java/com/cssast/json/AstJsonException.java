package com.cssast.json;

/**
 * Thrown when a provider fails to convert a CSS tree to or from JSON. The cause carries the
 * provider's own exception.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
