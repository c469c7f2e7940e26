package com.urlshortener.application.port.in;

import com.urlshortener.domain.error.LookupError;
import com.urlshortener.domain.model.Result;

/**
 * Resolves a short code to its original URL for redirects, consulting the cache first.
 */
public interface ResolveShortCodeUseCase {
    Result<String, LookupError> resolve(String shortCode);
}
