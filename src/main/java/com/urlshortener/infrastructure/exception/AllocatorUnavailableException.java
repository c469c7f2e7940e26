package com.urlshortener.infrastructure.exception;

public class AllocatorUnavailableException extends InfrastructureException {

    public AllocatorUnavailableException(String message, Throwable cause) {
        super("ALLOCATOR_UNAVAILABLE", message, cause);
    }

    public AllocatorUnavailableException(String message) {
        this(message, null);
    }
}
