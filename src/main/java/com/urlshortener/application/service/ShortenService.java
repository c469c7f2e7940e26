package com.urlshortener.application.service;

import com.urlshortener.application.port.in.ShortenUrlUseCase;
import com.urlshortener.application.port.out.IdAllocator;
import com.urlshortener.application.port.out.MetricsPort;
import com.urlshortener.application.port.out.SaltGenerator;
import com.urlshortener.application.port.out.UrlRecordRepository;
import com.urlshortener.domain.encoding.ShortCodeEncoder;
import com.urlshortener.domain.error.ShortenError;
import com.urlshortener.domain.model.OriginalUrl;
import com.urlshortener.domain.model.Result;
import com.urlshortener.domain.model.ShortCode;
import com.urlshortener.domain.model.UrlRecord;
import com.urlshortener.infrastructure.exception.AllocatorUnavailableException;
import com.urlshortener.infrastructure.exception.DuplicateShortCodeException;
import com.urlshortener.infrastructure.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Write path: allocate an id, salt and encode it, persist the record.
 *
 * <p>Nothing is retried here. A duplicate code is reported as-is rather than re-encoded with a
 * new salt, and the cache is not warmed: a new code stays cold until its first read.
 */
@Service
public class ShortenService implements ShortenUrlUseCase {

    private static final Logger log = LoggerFactory.getLogger(ShortenService.class);

    private final IdAllocator idAllocator;
    private final SaltGenerator saltGenerator;
    private final UrlRecordRepository urlRecordRepository;
    private final MetricsPort metrics;

    public ShortenService(
            IdAllocator idAllocator,
            SaltGenerator saltGenerator,
            UrlRecordRepository urlRecordRepository,
            MetricsPort metrics) {
        this.idAllocator = idAllocator;
        this.saltGenerator = saltGenerator;
        this.urlRecordRepository = urlRecordRepository;
        this.metrics = metrics;
    }

    @Override
    public Result<UrlRecord, ShortenError> shorten(String originalUrl) {
        var urlResult = OriginalUrl.parse(originalUrl);
        if (urlResult.isFailure()) {
            log.warn("URL validation failed: {}", urlResult.errorOrNull().message());
            return Result.failure(new ShortenError.ValidationFailed(urlResult.errorOrNull()));
        }
        OriginalUrl url = urlResult.getOrThrow();

        long id;
        ShortCode shortCode;
        try {
            id = idAllocator.nextId();
            shortCode = ShortCode.fromTrusted(ShortCodeEncoder.encode(id, saltGenerator.nextSalt()));
        } catch (AllocatorUnavailableException e) {
            log.error("Failed to allocate id: {}", e.getMessage(), e);
            metrics.incrementUrlCreateFailures();
            return Result.failure(new ShortenError.AllocationFailed(e.getMessage()));
        } catch (ArithmeticException | IllegalArgumentException e) {
            // overflow past Long.MAX_VALUE, or a negative id from a misconfigured counter
            log.error("Allocated id cannot be encoded: {}", e.getMessage());
            metrics.incrementUrlCreateFailures();
            return Result.failure(new ShortenError.AllocationFailed("allocated id out of range"));
        }

        UrlRecord saved;
        try {
            saved = urlRecordRepository.save(url.value(), shortCode);
        } catch (DuplicateShortCodeException e) {
            log.error("Short code collision: allocatedId={}, shortCode={}", id, shortCode);
            metrics.incrementUrlCreateFailures();
            return Result.failure(new ShortenError.DuplicateShortCode(shortCode.value()));
        } catch (StoreUnavailableException e) {
            log.error("Failed to save URL to database: {}", e.getMessage(), e);
            metrics.incrementUrlCreateFailures();
            return Result.failure(new ShortenError.PersistenceFailed(e.getMessage()));
        }

        metrics.incrementUrlsCreated();
        log.info("URL created: allocatedId={}, shortCode={}, recordId={}", id, shortCode, saved.id());
        return Result.success(saved);
    }
}
