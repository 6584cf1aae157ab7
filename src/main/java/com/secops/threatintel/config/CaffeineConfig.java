package com.secops.threatintel.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.secops.threatintel.model.CacheEntry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine 本地缓存配置
 * LOCAL 层条目按自身 expiresAt 过期，SHARED 回填的条目与远端保持相同的剩余寿命
 */
@Configuration
public class CaffeineConfig {

    private static final Logger log = LoggerFactory.getLogger(CaffeineConfig.class);

    @Bean("resultLocalCache")
    public Cache<String, CacheEntry> resultLocalCache(ThreatIntelProperties properties,
                                                     Clock clock,
                                                     MeterRegistry meterRegistry) {
        long maximumSize = properties.getCache().getLocalMaxSize();
        Cache<String, CacheEntry> cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(entryExpiry(clock))
            .removalListener((String key, CacheEntry value, RemovalCause cause) -> {
                if (cause == RemovalCause.SIZE) {
                    log.debug("Local entry evicted due to size: key={}", key);
                }
            })
            .recordStats()
            .build();

        CaffeineCacheMetrics.monitor(meterRegistry, cache, "threatintel_local_cache");

        log.info("Result local cache initialized: maximumSize={}, defaultTtl={}",
            maximumSize, properties.getCache().getLocalTtl());
        return cache;
    }

    static Expiry<String, CacheEntry> entryExpiry(Clock clock) {
        return new Expiry<>() {
            @Override
            public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
                return TimeUnit.MILLISECONDS.toNanos(value.remainingMillis(clock.millis()));
            }

            @Override
            public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
                return TimeUnit.MILLISECONDS.toNanos(value.remainingMillis(clock.millis()));
            }

            @Override
            public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
                return currentDuration;
            }
        };
    }
}
