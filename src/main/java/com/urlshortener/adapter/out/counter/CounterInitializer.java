package com.urlshortener.adapter.out.counter;

import com.urlshortener.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Raises the shared counter to its configured floor once per replica at startup, so the
 * first allocation returns exactly the floor and codes never start shorter than intended.
 *
 * <p>Read, compare and write happen in one Lua script, so replicas starting at the same time
 * cannot clobber increments made in between. A counter already at or above the floor is left
 * untouched.
 */
@Component
@ConditionalOnProperty(prefix = "app.api", name = "write-enabled", havingValue = "true", matchIfMissing = true)
public class CounterInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CounterInitializer.class);

    /**
     * KEYS[1] = counter key
     * ARGV[1] = floor
     * ARGV[2] = floor - 1
     *
     * Returns: 1 if the counter was reset, 0 if it was left untouched
     */
    static final RedisScript<Long> RAISE_TO_FLOOR_SCRIPT = new DefaultRedisScript<>(
            "local current = redis.call('GET', KEYS[1]) " +
            "if (not current) or (tonumber(current) < tonumber(ARGV[1])) then " +
            "    redis.call('SET', KEYS[1], ARGV[2]) " +
            "    return 1 " +
            "end " +
            "return 0",
            Long.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final AppProperties appProperties;

    public CounterInitializer(RedisTemplate<String, String> redisTemplate, AppProperties appProperties) {
        this.redisTemplate = redisTemplate;
        this.appProperties = appProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        initialize();
    }

    /**
     * @return true if the counter was moved up to the floor
     * @throws IllegalStateException if Redis cannot be reached; the replica must not serve writes
     */
    public boolean initialize() {
        String key = appProperties.getCounter().getKey();
        long floor = appProperties.getCounter().getFloor();

        Long reset;
        try {
            reset = redisTemplate.execute(
                RAISE_TO_FLOOR_SCRIPT,
                List.of(key),
                String.valueOf(floor),
                String.valueOf(floor - 1)
            );
        } catch (DataAccessException e) {
            throw new IllegalStateException("Failed to initialize counter " + key, e);
        }

        boolean wasReset = reset != null && reset == 1L;
        if (wasReset) {
            log.info("Initialized counter {} to start from {}", key, floor);
        } else {
            log.info("Counter {} already at or above floor {}", key, floor);
        }
        return wasReset;
    }
}
