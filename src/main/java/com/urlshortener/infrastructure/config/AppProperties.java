package com.urlshortener.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app")
@Validated
public class AppProperties {

    @Valid
    private Counter counter = new Counter();
    private Cache cache = new Cache();
    private ShortUrl shortUrl = new ShortUrl();
    private Api api = new Api();

    public Counter getCounter() {
        return counter;
    }

    public void setCounter(Counter counter) {
        this.counter = counter;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public ShortUrl getShortUrl() {
        return shortUrl;
    }

    public void setShortUrl(ShortUrl shortUrl) {
        this.shortUrl = shortUrl;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public static class Counter {
        private String key = "url_counter";
        // 62^6: keeps the first codes at eight base-62 digits
        @Min(1)
        private long floor = 56_800_235_584L;

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public long getFloor() {
            return floor;
        }

        public void setFloor(long floor) {
            this.floor = floor;
        }
    }

    public static class Cache {
        private String keyPrefix = "url:";
        private Duration ttl = Duration.ofMinutes(30);

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class ShortUrl {
        private String baseUrl = "http://localhost:8000/";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    public static class Api {
        private boolean writeEnabled = true;
        private boolean readEnabled = true;

        public boolean isWriteEnabled() {
            return writeEnabled;
        }

        public void setWriteEnabled(boolean writeEnabled) {
            this.writeEnabled = writeEnabled;
        }

        public boolean isReadEnabled() {
            return readEnabled;
        }

        public void setReadEnabled(boolean readEnabled) {
            this.readEnabled = readEnabled;
        }
    }
}
