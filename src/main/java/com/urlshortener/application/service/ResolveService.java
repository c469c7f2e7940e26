package com.urlshortener.application.service;

import com.urlshortener.application.port.in.GetUrlRecordUseCase;
import com.urlshortener.application.port.in.ResolveShortCodeUseCase;
import com.urlshortener.application.port.out.MetricsPort;
import com.urlshortener.application.port.out.UrlCache;
import com.urlshortener.application.port.out.UrlRecordRepository;
import com.urlshortener.domain.error.LookupError;
import com.urlshortener.domain.model.Result;
import com.urlshortener.domain.model.ShortCode;
import com.urlshortener.domain.model.UrlRecord;
import com.urlshortener.infrastructure.config.AppProperties;
import com.urlshortener.infrastructure.exception.CacheUnavailableException;
import com.urlshortener.infrastructure.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Read path: cache-aside lookup with write-back on miss.
 *
 * <p>A cache hit is answered without touching the store. Cache failures are logged and
 * treated as a miss; they never fail a read.
 */
@Service
public class ResolveService implements ResolveShortCodeUseCase, GetUrlRecordUseCase {

    private static final Logger log = LoggerFactory.getLogger(ResolveService.class);

    private final UrlCache urlCache;
    private final UrlRecordRepository urlRecordRepository;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public ResolveService(
            UrlCache urlCache,
            UrlRecordRepository urlRecordRepository,
            AppProperties appProperties,
            MetricsPort metrics) {
        this.urlCache = urlCache;
        this.urlRecordRepository = urlRecordRepository;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Override
    public Result<String, LookupError> resolve(String code) {
        var codeResult = ShortCode.parse(code);
        if (codeResult.isFailure()) {
            return Result.failure(new LookupError.InvalidCode(codeResult.errorOrNull()));
        }
        ShortCode shortCode = codeResult.getOrThrow();

        Optional<String> cached = readCache(shortCode);
        if (cached.isPresent()) {
            metrics.incrementCacheHits();
            metrics.incrementRedirects();
            log.debug("Cache hit for shortCode={}", shortCode);
            return Result.success(cached.get());
        }
        metrics.incrementCacheMisses();

        Result<String, LookupError> result = loadFromStore(shortCode).map(UrlRecord::originalUrl);
        if (result.isSuccess()) {
            metrics.incrementRedirects();
        }
        return result;
    }

    @Override
    public Result<UrlRecord, LookupError> getByShortCode(String code) {
        var codeResult = ShortCode.parse(code);
        if (codeResult.isFailure()) {
            return Result.failure(new LookupError.InvalidCode(codeResult.errorOrNull()));
        }
        return loadFromStore(codeResult.getOrThrow());
    }

    private Result<UrlRecord, LookupError> loadFromStore(ShortCode shortCode) {
        Optional<UrlRecord> found;
        try {
            found = urlRecordRepository.findByShortCode(shortCode);
        } catch (StoreUnavailableException e) {
            log.error("Failed to get URL from database: {}", e.getMessage(), e);
            return Result.failure(new LookupError.StoreUnavailable(e.getMessage()));
        }

        if (found.isEmpty()) {
            log.warn("Short code not found: {}", shortCode);
            return Result.failure(new LookupError.NotFound(shortCode.value()));
        }

        UrlRecord record = found.get();
        writeCache(shortCode, record.originalUrl());
        log.debug("Resolved shortCode={} from store, recordId={}", shortCode, record.id());
        return Result.success(record);
    }

    private Optional<String> readCache(ShortCode shortCode) {
        try {
            return urlCache.get(shortCode);
        } catch (CacheUnavailableException e) {
            log.warn("Cache read failed, falling back to store: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(ShortCode shortCode, String originalUrl) {
        try {
            urlCache.put(shortCode, originalUrl, appProperties.getCache().getTtl());
        } catch (CacheUnavailableException e) {
            log.warn("Cache write failed for shortCode={}: {}", shortCode, e.getMessage());
        }
    }
}
