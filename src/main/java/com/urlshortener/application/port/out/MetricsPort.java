package com.urlshortener.application.port.out;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementUrlsCreated();

    void incrementUrlCreateFailures();

    void incrementRedirects();

    void incrementCacheHits();

    void incrementCacheMisses();
}
