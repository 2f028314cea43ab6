package com.funnelanalytics.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis cache for analysis responses.
 *
 * Funnel, timing and journey results for a closed time window do not change,
 * so identical requests are served from here until the TTL runs out.
 *
 * Failure Handling:
 * - Circuit breaker stops calling Redis after repeated failures
 * - Every failure degrades to a cache miss; the analysis then runs against the warehouse
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryCacheService {

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    @CircuitBreaker(name = "redis", fallbackMethod = "getCacheFallback")
    public <T> Optional<T> get(String key, Class<T> type) {
        String cached = redisTemplate.opsForValue().get(key);
        if (cached == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }

        try {
            T value = objectMapper.readValue(cached, type);
            log.debug("Cache hit for key: {}", key);
            return Optional.of(value);
        } catch (JsonProcessingException e) {
            // stale shape from an older release
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
            redisTemplate.delete(key);
            return Optional.empty();
        }
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "setCacheFallback")
    public void set(String key, Object value, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            return;
        }
        try {
            String json = objectMapper.writeValueAsString(value);
            redisTemplate.opsForValue().set(key, json, ttlSeconds, TimeUnit.SECONDS);
            log.debug("Cached result for key: {} (TTL: {}s)", key, ttlSeconds);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize {} for cache key {}: {}",
                    value.getClass().getSimpleName(), key, e.getOriginalMessage());
        }
    }

    /**
     * Key of the form {@code prefix:md5(params)}; step lists make raw keys too long.
     */
    public String generateCacheKey(String prefix, Object... params) {
        StringBuilder material = new StringBuilder();
        for (Object param : params) {
            material.append('|').append(param != null ? param.toString() : "null");
        }
        return prefix + ":" + DigestUtils.md5DigestAsHex(material.toString().getBytes(StandardCharsets.UTF_8));
    }

    // Fallback methods (circuit breaker)

    private <T> Optional<T> getCacheFallback(String key, Class<T> type, Exception e) {
        log.warn("Redis unavailable ({}), computing without cache", e.getMessage());
        return Optional.empty();
    }

    private void setCacheFallback(String key, Object value, long ttlSeconds, Exception e) {
        log.warn("Redis unavailable ({}), skipping cache write", e.getMessage());
    }
}
