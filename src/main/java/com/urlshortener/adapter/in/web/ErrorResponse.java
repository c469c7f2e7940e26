package com.urlshortener.adapter.in.web;

import com.urlshortener.infrastructure.context.RequestContext;

public record ErrorResponse(
    String error,
    String message,
    String requestId
) {
    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, RequestContext.getRequestId());
    }
}
