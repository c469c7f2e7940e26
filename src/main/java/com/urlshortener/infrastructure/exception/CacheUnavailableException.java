package com.urlshortener.infrastructure.exception;

public class CacheUnavailableException extends InfrastructureException {

    public CacheUnavailableException(String message, Throwable cause) {
        super("CACHE_UNAVAILABLE", message, cause);
    }
}
