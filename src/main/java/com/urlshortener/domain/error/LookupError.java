package com.urlshortener.domain.error;

/**
 * Sealed type representing the ways resolving a short code can fail.
 */
public sealed interface LookupError {

    record InvalidCode(ValidationError error) implements LookupError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    record NotFound(String shortCode) implements LookupError {
        @Override
        public String message() {
            return "short code not found";
        }

        @Override
        public String code() {
            return "SHORT_CODE_NOT_FOUND";
        }
    }

    record StoreUnavailable(String detail) implements LookupError {
        @Override
        public String message() {
            return "failed to retrieve URL";
        }

        @Override
        public String code() {
            return "STORE_UNAVAILABLE";
        }
    }

    String message();

    String code();
}
