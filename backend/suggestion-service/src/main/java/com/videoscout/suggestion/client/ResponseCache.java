package com.videoscout.suggestion.client;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Policy;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Short-lived response cache with a hard entry cap.
 *
 * Entries expire a fixed time after being written. When the cap is reached the oldest
 * written entry is evicted before the new one goes in, so the cache never exceeds the cap
 * and eviction order is insertion order rather than Caffeine's frequency-based sizing.
 */
@Slf4j
public class ResponseCache<V> {

    private final String name;
    private final int maxEntries;
    private final Cache<String, V> cache;

    public ResponseCache(String name, Duration ttl, int maxEntries) {
        this(name, ttl, maxEntries, Ticker.systemTicker());
    }

    ResponseCache(String name, Duration ttl, int maxEntries, Ticker ticker) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.name = name;
        this.maxEntries = maxEntries;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    public Optional<V> get(String key) {
        V value = cache.getIfPresent(key);
        if (value != null) {
            log.debug("Cache HIT [{}]: {}", name, key);
            return Optional.of(value);
        }
        log.debug("Cache MISS [{}]: {}", name, key);
        return Optional.empty();
    }

    public synchronized void put(String key, V value) {
        cache.cleanUp();
        if (cache.getIfPresent(key) == null) {
            long overflow = cache.estimatedSize() - maxEntries + 1;
            if (overflow > 0) {
                evictOldest((int) overflow);
            }
        }
        cache.put(key, value);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private void evictOldest(int count) {
        Optional<Policy.FixedExpiration<String, V>> expiration = cache.policy().expireAfterWrite();
        if (expiration.isEmpty()) {
            return;
        }
        Map<String, V> oldest = expiration.get().oldest(count);
        cache.invalidateAll(oldest.keySet());
        log.debug("Cache [{}] full ({} entries), evicted {} oldest", name, maxEntries, oldest.size());
    }
}
