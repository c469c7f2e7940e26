package com.urlshortener.infrastructure.exception;

/**
 * Base type for failures of the shared backing services (counter, store, cache).
 * Carries a stable error code that ends up in logs and error bodies.
 */
public abstract class InfrastructureException extends RuntimeException {

    private final String errorCode;

    protected InfrastructureException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
