package com.urlshortener.application.port.in;

import com.urlshortener.domain.error.ShortenError;
import com.urlshortener.domain.model.Result;
import com.urlshortener.domain.model.UrlRecord;

public interface ShortenUrlUseCase {
    Result<UrlRecord, ShortenError> shorten(String originalUrl);
}
