package com.example.footprint.service.cache;

import com.example.footprint.model.CacheEntry;
import com.example.footprint.model.FootprintResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Локальный кэш результатов на Caffeine с ограничением размера.
 */
public class CaffeineFootprintCache implements FootprintCache {

    private final Cache<String, CacheEntry> cache;
    private final Clock clock;

    public CaffeineFootprintCache(long maxEntries, Duration ttl, Clock clock) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .recordStats()
                .maximumSize(maxEntries);
        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
            builder.expireAfterWrite(ttl);
        }
        this.cache = builder.build();
        this.clock = clock;
    }

    @Override
    public Optional<FootprintResult> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key)).map(CacheEntry::getValue);
    }

    @Override
    public void put(String key, FootprintResult value) {
        cache.put(key, CacheEntry.builder()
                .key(key)
                .value(value)
                .writtenAt(clock.instant())
                .build());
    }

    @Override
    public String backendName() {
        return "caffeine";
    }
}
