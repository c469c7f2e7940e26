package com.urlshortener.adapter.out.counter;

import com.urlshortener.application.port.out.IdAllocator;
import com.urlshortener.infrastructure.config.AppProperties;
import com.urlshortener.infrastructure.exception.AllocatorUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Allocates ids with Redis {@code INCR} on a single shared key. Redis executes commands
 * one at a time, so every replica sees a distinct, strictly increasing value.
 * Ranges are never pre-allocated.
 */
@Component
public class RedisIdAllocator implements IdAllocator {

    private static final Logger log = LoggerFactory.getLogger(RedisIdAllocator.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final AppProperties appProperties;

    public RedisIdAllocator(RedisTemplate<String, String> redisTemplate, AppProperties appProperties) {
        this.redisTemplate = redisTemplate;
        this.appProperties = appProperties;
    }

    @Override
    public long nextId() {
        String key = appProperties.getCounter().getKey();
        Long value;
        try {
            value = redisTemplate.opsForValue().increment(key);
        } catch (DataAccessException e) {
            throw new AllocatorUnavailableException("Failed to increment counter " + key, e);
        }
        // null only when the command ran inside a pipeline or transaction
        if (value == null) {
            throw new AllocatorUnavailableException("Increment of counter " + key + " was not confirmed");
        }
        log.debug("Allocated id {} from counter {}", value, key);
        return value;
    }
}
