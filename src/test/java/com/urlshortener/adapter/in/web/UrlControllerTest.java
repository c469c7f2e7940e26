package com.urlshortener.adapter.in.web;

import com.urlshortener.application.port.in.ShortenUrlUseCase;
import com.urlshortener.domain.error.ShortenError;
import com.urlshortener.domain.error.ValidationError;
import com.urlshortener.domain.model.Result;
import com.urlshortener.domain.model.ShortCode;
import com.urlshortener.domain.model.UrlRecord;
import com.urlshortener.infrastructure.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(UrlController.class)
class UrlControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ShortenUrlUseCase shortenUrlUseCase;

    @MockBean
    private AppProperties appProperties;

    @BeforeEach
    void setUp() {
        AppProperties.ShortUrl shortUrl = new AppProperties.ShortUrl();
        shortUrl.setBaseUrl("http://localhost:8000/");
        when(appProperties.getShortUrl()).thenReturn(shortUrl);
    }

    @Test
    void shouldCreateShortUrl() throws Exception {
        Instant now = Instant.now();
        UrlRecord saved = new UrlRecord(7, "https://example.com", ShortCode.fromTrusted("3p0TyGVe"), now, now);
        when(shortenUrlUseCase.shorten(eq("https://example.com"))).thenReturn(Result.success(saved));

        mockMvc.perform(post("/api/v1/urls")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"originalUrl\":\"https://example.com\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(7))
            .andExpect(jsonPath("$.shortCode").value("3p0TyGVe"))
            .andExpect(jsonPath("$.originalUrl").value("https://example.com"))
            .andExpect(jsonPath("$.shortUrl").value("http://localhost:8000/3p0TyGVe"))
            .andExpect(header().exists("X-Request-Id"));
    }

    @Test
    void shouldRejectInvalidUrl() throws Exception {
        when(shortenUrlUseCase.shorten(eq("not a url")))
            .thenReturn(Result.failure(new ShortenError.ValidationFailed(
                new ValidationError.UrlError.InvalidFormat("not a url", "Illegal character in path"))));

        mockMvc.perform(post("/api/v1/urls")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"originalUrl\":\"not a url\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("URL_INVALID_FORMAT"));
    }

    @Test
    void shouldRejectMissingUrl() throws Exception {
        mockMvc.perform(post("/api/v1/urls")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verifyNoInteractions(shortenUrlUseCase);
    }

    @Test
    void shouldRejectMalformedJson() throws Exception {
        mockMvc.perform(post("/api/v1/urls")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"originalUrl\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void shouldReturnServerErrorWhenAllocationFails() throws Exception {
        when(shortenUrlUseCase.shorten(anyString()))
            .thenReturn(Result.failure(new ShortenError.AllocationFailed("redis down")));

        mockMvc.perform(post("/api/v1/urls")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"originalUrl\":\"https://example.com\"}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("ALLOCATION_FAILED"))
            .andExpect(jsonPath("$.message").value("failed to generate short URL"));
    }

    @Test
    void shouldReturnServerErrorOnDuplicateShortCode() throws Exception {
        when(shortenUrlUseCase.shorten(anyString()))
            .thenReturn(Result.failure(new ShortenError.DuplicateShortCode("3p0TyGVe")));

        mockMvc.perform(post("/api/v1/urls")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"originalUrl\":\"https://example.com\"}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("DUPLICATE_SHORT_CODE"));
    }

    @Test
    void shouldEchoRequestIdInErrorBody() throws Exception {
        when(shortenUrlUseCase.shorten(anyString()))
            .thenReturn(Result.failure(new ShortenError.PersistenceFailed("db down")));

        mockMvc.perform(post("/api/v1/urls")
                .header("X-Request-Id", "req-123")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"originalUrl\":\"https://example.com\"}"))
            .andExpect(status().isInternalServerError())
            .andExpect(header().string("X-Request-Id", "req-123"))
            .andExpect(jsonPath("$.requestId").value("req-123"));
    }
}
