package com.example.footprint.service.cache;

import com.example.footprint.exception.CacheException;
import com.example.footprint.model.CacheEntry;
import com.example.footprint.model.FootprintResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Распределённый кэш результатов в Redis. Записи хранятся под ключом
 * {@code {prefix}:cache:{key}}; без TTL записи сохраняются для аудита.
 */
public class RedisFootprintCache implements FootprintCache {

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration ttl;
    private final Clock clock;

    public RedisFootprintCache(StringRedisTemplate redis,
                               ObjectMapper objectMapper,
                               String keyPrefix,
                               Duration ttl,
                               Clock clock) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public Optional<FootprintResult> get(String key) {
        String json;
        try {
            json = redis.opsForValue().get(redisKey(key));
        } catch (DataAccessException e) {
            throw new CacheException("Cache read failed for " + key + ": " + e.getMessage(), e);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(json, CacheEntry.class).getValue());
        } catch (JsonProcessingException e) {
            throw new CacheException("Corrupted cache entry " + key + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public void put(String key, FootprintResult value) {
        String json;
        try {
            json = objectMapper.writeValueAsString(CacheEntry.builder()
                    .key(key)
                    .value(value)
                    .writtenAt(clock.instant())
                    .build());
        } catch (JsonProcessingException e) {
            throw new CacheException("Failed to serialize cache entry " + key, e);
        }
        try {
            if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
                redis.opsForValue().set(redisKey(key), json, ttl);
            } else {
                redis.opsForValue().set(redisKey(key), json);
            }
        } catch (DataAccessException e) {
            throw new CacheException("Cache write failed for " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String backendName() {
        return "redis";
    }

    private String redisKey(String key) {
        return keyPrefix + ":cache:" + key;
    }
}
