package com.urlshortener.adapter.in.web;

import com.urlshortener.application.port.in.ShortenUrlUseCase;
import com.urlshortener.domain.error.ShortenError;
import com.urlshortener.domain.model.UrlRecord;
import com.urlshortener.infrastructure.config.AppProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "URLs", description = "Short URL creation")
@ConditionalOnProperty(prefix = "app.api", name = "write-enabled", havingValue = "true", matchIfMissing = true)
public class UrlController {

    private final ShortenUrlUseCase shortenUrlUseCase;
    private final AppProperties appProperties;

    public UrlController(ShortenUrlUseCase shortenUrlUseCase, AppProperties appProperties) {
        this.shortenUrlUseCase = shortenUrlUseCase;
        this.appProperties = appProperties;
    }

    @PostMapping("/urls")
    @Operation(summary = "Shorten a URL", description = "Allocates a unique short code for an http(s) URL")
    public ResponseEntity<?> createShortUrl(@Valid @RequestBody CreateUrlRequest request) {
        return shortenUrlUseCase.shorten(request.originalUrl()).fold(
            saved -> ResponseEntity.status(HttpStatus.CREATED).body(toResponse(saved)),
            this::toErrorResponse
        );
    }

    private CreateUrlResponse toResponse(UrlRecord saved) {
        String shortCode = saved.shortCode().value();
        return new CreateUrlResponse(
            saved.id(),
            shortCode,
            saved.originalUrl(),
            appProperties.getShortUrl().getBaseUrl() + shortCode
        );
    }

    private ResponseEntity<ErrorResponse> toErrorResponse(ShortenError error) {
        HttpStatus status = error instanceof ShortenError.ValidationFailed
            ? HttpStatus.BAD_REQUEST
            : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(ErrorResponse.of(error.code(), error.message()));
    }

    public record CreateUrlRequest(
        @NotBlank(message = "originalUrl is required") String originalUrl
    ) {}

    public record CreateUrlResponse(
        long id,
        String shortCode,
        String originalUrl,
        String shortUrl
    ) {}
}
