package com.urlshortener.infrastructure.exception;

/**
 * The store's unique constraint on short codes rejected an insert.
 */
public class DuplicateShortCodeException extends InfrastructureException {

    private final String shortCode;

    public DuplicateShortCodeException(String shortCode, Throwable cause) {
        super("DUPLICATE_SHORT_CODE", "Short code already exists: " + shortCode, cause);
        this.shortCode = shortCode;
    }

    public String getShortCode() {
        return shortCode;
    }
}
