package com.urlshortener.application.port.out;

/**
 * Port for the per-request salt mixed into an allocated id before encoding.
 */
public interface SaltGenerator {

    /**
     * Returns a value in {@code [0, 1000)}, drawn independently per call.
     */
    int nextSalt();
}
