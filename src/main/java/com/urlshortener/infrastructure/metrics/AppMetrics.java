package com.urlshortener.infrastructure.metrics;

import com.urlshortener.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class AppMetrics implements MetricsPort {

    private final Counter urlsCreated;
    private final Counter urlCreateFailures;
    private final Counter redirects;
    private final Counter cacheHits;
    private final Counter cacheMisses;

    public AppMetrics(MeterRegistry registry) {
        this.urlsCreated = Counter.builder("urls_created_total")
            .description("Total number of short URLs created")
            .register(registry);

        this.urlCreateFailures = Counter.builder("url_create_failures_total")
            .description("Create requests that failed on allocation or persistence")
            .register(registry);

        this.redirects = Counter.builder("redirects_total")
            .description("Total number of short codes resolved for redirect")
            .register(registry);

        this.cacheHits = Counter.builder("url_cache_hits_total")
            .description("Resolutions answered from the cache")
            .register(registry);

        this.cacheMisses = Counter.builder("url_cache_misses_total")
            .description("Resolutions that fell through to the record store")
            .register(registry);
    }

    @Override
    public void incrementUrlsCreated() {
        urlsCreated.increment();
    }

    @Override
    public void incrementUrlCreateFailures() {
        urlCreateFailures.increment();
    }

    @Override
    public void incrementRedirects() {
        redirects.increment();
    }

    @Override
    public void incrementCacheHits() {
        cacheHits.increment();
    }

    @Override
    public void incrementCacheMisses() {
        cacheMisses.increment();
    }
}
