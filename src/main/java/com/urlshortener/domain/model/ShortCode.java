package com.urlshortener.domain.model;

import com.urlshortener.domain.error.ValidationError.ShortCodeError;

/**
 * Value Object for a short code as it appears in a request path or in the store.
 */
public record ShortCode(String value) {

    public ShortCode {
        if (value == null) {
            throw new IllegalStateException("ShortCode value cannot be null - use parse() for validation");
        }
    }

    /**
     * Parses a code taken from a request. Only emptiness is rejected here:
     * a code with unexpected characters is simply unknown and resolves to not-found.
     */
    public static Result<ShortCode, ShortCodeError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(ShortCodeError.Empty.INSTANCE);
        }
        return Result.success(new ShortCode(value));
    }

    /**
     * Wraps a code produced by this system (encoder output, database row).
     */
    public static ShortCode fromTrusted(String value) {
        return new ShortCode(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
