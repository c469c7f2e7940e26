package com.urlshortener.application.port.out;

import com.urlshortener.domain.model.ShortCode;

import java.time.Duration;
import java.util.Optional;

/**
 * Ephemeral short code to URL cache. Never authoritative: a miss says nothing about
 * whether the code exists. Failures surface as {@code CacheUnavailableException} and
 * callers are expected to degrade to the store.
 */
public interface UrlCache {
    Optional<String> get(ShortCode shortCode);
    void put(ShortCode shortCode, String originalUrl, Duration ttl);
}
