package com.urlshortener.application.port.out;

import com.urlshortener.domain.model.ShortCode;
import com.urlshortener.domain.model.UrlRecord;

import java.util.Optional;

/**
 * Durable, authoritative store of short code to URL mappings.
 * Failures surface as {@code StoreUnavailableException}; a rejected duplicate code as
 * {@code DuplicateShortCodeException}.
 */
public interface UrlRecordRepository {
    UrlRecord save(String originalUrl, ShortCode shortCode);
    Optional<UrlRecord> findByShortCode(ShortCode shortCode);
}
