package com.urlshortener.adapter.in.web;

import com.urlshortener.domain.error.LookupError;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * HTTP mapping shared by every endpoint that resolves a short code.
 */
final class LookupErrors {

    private LookupErrors() {}

    static ResponseEntity<ErrorResponse> toResponse(LookupError error) {
        HttpStatus status;
        if (error instanceof LookupError.InvalidCode) {
            status = HttpStatus.BAD_REQUEST;
        } else if (error instanceof LookupError.NotFound) {
            status = HttpStatus.NOT_FOUND;
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(error.code(), error.message()));
    }
}
