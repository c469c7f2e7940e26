package com.urlshortener.adapter.out.cache;

import com.urlshortener.application.port.out.UrlCache;
import com.urlshortener.domain.model.ShortCode;
import com.urlshortener.infrastructure.config.AppProperties;
import com.urlshortener.infrastructure.exception.CacheUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

@Repository
public class RedisUrlCache implements UrlCache {

    private static final Logger log = LoggerFactory.getLogger(RedisUrlCache.class);

    private final ValueOperations<String, String> valueOps;
    private final AppProperties appProperties;

    public RedisUrlCache(RedisTemplate<String, String> redisTemplate, AppProperties appProperties) {
        this.valueOps = redisTemplate.opsForValue();
        this.appProperties = appProperties;
    }

    @Override
    public Optional<String> get(ShortCode shortCode) {
        String key = cacheKey(shortCode);
        try {
            return Optional.ofNullable(valueOps.get(key));
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Failed to read " + key, e);
        }
    }

    @Override
    public void put(ShortCode shortCode, String originalUrl, Duration ttl) {
        String key = cacheKey(shortCode);
        try {
            // Plain SET: last writer wins and the TTL restarts
            valueOps.set(key, originalUrl, ttl);
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Failed to write " + key, e);
        }
        log.debug("Cached {} for {}", key, ttl);
    }

    private String cacheKey(ShortCode shortCode) {
        return appProperties.getCache().getKeyPrefix() + shortCode.value();
    }
}
