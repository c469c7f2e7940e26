package com.urlshortener.adapter.in.web;

import com.urlshortener.application.port.in.GetUrlRecordUseCase;
import com.urlshortener.domain.model.UrlRecord;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "URLs", description = "Short URL metadata")
@ConditionalOnProperty(prefix = "app.api", name = "read-enabled", havingValue = "true", matchIfMissing = true)
public class UrlQueryController {

    private final GetUrlRecordUseCase getUrlRecordUseCase;

    public UrlQueryController(GetUrlRecordUseCase getUrlRecordUseCase) {
        this.getUrlRecordUseCase = getUrlRecordUseCase;
    }

    // "/urls/" is mapped so that an empty code gets a 400 instead of a generic 404
    @GetMapping({"/urls/", "/urls/{shortCode}"})
    @Operation(summary = "Get URL record", description = "Returns the stored record for a short code")
    public ResponseEntity<?> getUrl(
            @Parameter(description = "Short code", example = "3p0TyGVe")
            @PathVariable(required = false) String shortCode) {
        return getUrlRecordUseCase.getByShortCode(shortCode).fold(
            record -> ResponseEntity.ok(UrlRecordResponse.from(record)),
            LookupErrors::toResponse
        );
    }

    public record UrlRecordResponse(
        long id,
        String originalUrl,
        String shortCode,
        Instant createdAt,
        Instant updatedAt
    ) {
        public static UrlRecordResponse from(UrlRecord record) {
            return new UrlRecordResponse(
                record.id(),
                record.originalUrl(),
                record.shortCode().value(),
                record.createdAt(),
                record.updatedAt()
            );
        }
    }
}
