package com.urlshortener.adapter.in.web;

import com.urlshortener.application.port.in.ResolveShortCodeUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Redirect", description = "Short code resolution")
@ConditionalOnProperty(prefix = "app.api", name = "read-enabled", havingValue = "true", matchIfMissing = true)
public class RedirectController {

    private final ResolveShortCodeUseCase resolveShortCodeUseCase;

    public RedirectController(ResolveShortCodeUseCase resolveShortCodeUseCase) {
        this.resolveShortCodeUseCase = resolveShortCodeUseCase;
    }

    // "/" is mapped so that an empty code gets a 400 instead of a generic 404
    @GetMapping({"/", "/{shortCode}"})
    @Operation(summary = "Redirect", description = "Responds with 302 to the original URL of a short code")
    public ResponseEntity<?> redirect(
            @Parameter(description = "Short code", example = "3p0TyGVe")
            @PathVariable(required = false) String shortCode) {
        return resolveShortCodeUseCase.resolve(shortCode).fold(
            originalUrl -> ResponseEntity.status(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, originalUrl)
                .build(),
            LookupErrors::toResponse
        );
    }
}
