package com.urlshortener.infrastructure.exception;

public class StoreUnavailableException extends InfrastructureException {

    public StoreUnavailableException(String message, Throwable cause) {
        super("STORE_UNAVAILABLE", message, cause);
    }
}
