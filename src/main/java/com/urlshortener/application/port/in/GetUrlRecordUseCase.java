package com.urlshortener.application.port.in;

import com.urlshortener.domain.error.LookupError;
import com.urlshortener.domain.model.Result;
import com.urlshortener.domain.model.UrlRecord;

public interface GetUrlRecordUseCase {
    Result<UrlRecord, LookupError> getByShortCode(String shortCode);
}
