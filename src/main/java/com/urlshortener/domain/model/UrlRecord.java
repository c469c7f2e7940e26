package com.urlshortener.domain.model;

import java.time.Instant;

/**
 * A persisted mapping from short code to original URL.
 *
 * @param id        identity assigned by the store on insert, unrelated to the allocator's counter value
 * @param updatedAt refreshed by the store on every row update
 */
public record UrlRecord(
    long id,
    String originalUrl,
    ShortCode shortCode,
    Instant createdAt,
    Instant updatedAt
) {}
