package net.convertcompress.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory for the engine's Caffeine caches (thumbnails, size estimates), so every cache
 * is bounded and records stats the same way.
 */
@Slf4j
@Component
public class CacheFactory {

    /**
     * Create a cache with a size limit and time-to-live.
     */
    public <K, V> Cache<K, V> createCache(String name, int maxSize, Duration ttl) {
        log.debug("Creating cache '{}' (max {}, ttl {})", name, maxSize, ttl);
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(ttl)
            .recordStats()
            .build();
    }

    /**
     * Create a cache with a size limit only (no TTL).
     */
    public <K, V> Cache<K, V> createCacheWithSize(String name, int maxSize) {
        log.debug("Creating cache '{}' (max {})", name, maxSize);
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .recordStats()
            .build();
    }
}
