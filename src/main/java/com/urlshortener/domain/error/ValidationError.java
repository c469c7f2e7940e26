package com.urlshortener.domain.error;

/**
 * Sealed type representing input validation errors.
 * These are client faults and are never retried.
 */
public sealed interface ValidationError {

    String message();

    String code();

    // Original URL validation errors
    sealed interface UrlError extends ValidationError {

        record Empty() implements UrlError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "originalUrl is required";
            }

            @Override
            public String code() {
                return "URL_EMPTY";
            }
        }

        record InvalidFormat(String value, String reason) implements UrlError {
            @Override
            public String message() {
                return "invalid url: " + reason;
            }

            @Override
            public String code() {
                return "URL_INVALID_FORMAT";
            }
        }

        record TooLong(int length, int maxLength) implements UrlError {
            @Override
            public String message() {
                return "originalUrl exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "URL_TOO_LONG";
            }
        }
    }

    // Short code validation errors
    sealed interface ShortCodeError extends ValidationError {

        record Empty() implements ShortCodeError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "short code is required";
            }

            @Override
            public String code() {
                return "SHORT_CODE_EMPTY";
            }
        }
    }
}
