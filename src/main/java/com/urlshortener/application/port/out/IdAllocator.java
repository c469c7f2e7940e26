package com.urlshortener.application.port.out;

/**
 * Port for the shared, fleet-wide counter that makes short codes unique.
 */
public interface IdAllocator {

    /**
     * Atomically increments the shared counter by one and returns the new value.
     * No two calls anywhere in the fleet observe the same value. Not retried internally.
     *
     * @throws com.urlshortener.infrastructure.exception.AllocatorUnavailableException
     *         if the counter store cannot be reached or the increment cannot be confirmed
     */
    long nextId();
}
