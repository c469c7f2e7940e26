package com.urlshortener.domain.error;

/**
 * Sealed type representing the ways a create request can fail.
 * {@link ValidationFailed} is a client fault; every other variant is an infrastructure
 * or integrity fault and maps to a server error.
 */
public sealed interface ShortenError {

    /**
     * Wraps a validation error on the submitted URL.
     */
    record ValidationFailed(ValidationError error) implements ShortenError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    record AllocationFailed(String detail) implements ShortenError {
        @Override
        public String message() {
            return "failed to generate short URL";
        }

        @Override
        public String code() {
            return "ALLOCATION_FAILED";
        }
    }

    record PersistenceFailed(String detail) implements ShortenError {
        @Override
        public String message() {
            return "failed to save URL";
        }

        @Override
        public String code() {
            return "PERSISTENCE_FAILED";
        }
    }

    /**
     * The store rejected the encoded code because another record already holds it.
     * Not retried with a new salt.
     */
    record DuplicateShortCode(String shortCode) implements ShortenError {
        @Override
        public String message() {
            return "short code collision: " + shortCode;
        }

        @Override
        public String code() {
            return "DUPLICATE_SHORT_CODE";
        }
    }

    String message();

    String code();
}
