package com.urlshortener.domain.model;

import com.urlshortener.domain.error.ValidationError.UrlError;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * Value Object for a long URL submitted for shortening.
 * Only syntax is checked; the target is never contacted.
 */
public record OriginalUrl(String value) {

    public static final int MAX_LENGTH = 2048;

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");

    public OriginalUrl {
        if (value == null) {
            throw new IllegalStateException("OriginalUrl value cannot be null - use parse() for validation");
        }
    }

    /**
     * Parses user input, returning a Result for expected validation failures.
     * An ASCII URL is kept exactly as submitted (apart from surrounding whitespace)
     * so a redirect returns it unchanged. Non-ASCII characters are percent-encoded as
     * UTF-8, since the value ends up in a {@code Location} header.
     */
    public static Result<OriginalUrl, UrlError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(UrlError.Empty.INSTANCE);
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_LENGTH) {
            return Result.failure(new UrlError.TooLong(trimmed.length(), MAX_LENGTH));
        }

        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            return Result.failure(new UrlError.InvalidFormat(trimmed, e.getReason()));
        }
        if (uri.getScheme() == null || !ALLOWED_SCHEMES.contains(uri.getScheme().toLowerCase(Locale.ROOT))) {
            return Result.failure(new UrlError.InvalidFormat(trimmed, "scheme must be http or https"));
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            return Result.failure(new UrlError.InvalidFormat(trimmed, "host is missing"));
        }
        String ascii = uri.toASCIIString();
        if (ascii.length() > MAX_LENGTH) {
            return Result.failure(new UrlError.TooLong(ascii.length(), MAX_LENGTH));
        }
        return Result.success(new OriginalUrl(ascii));
    }

    @Override
    public String toString() {
        return value;
    }
}
