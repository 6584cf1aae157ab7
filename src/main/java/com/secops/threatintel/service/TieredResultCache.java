package com.secops.threatintel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.secops.threatintel.config.ThreatIntelProperties;
import com.secops.threatintel.constant.CacheConstants;
import com.secops.threatintel.model.CacheEntry;
import com.secops.threatintel.model.CacheTier;
import com.secops.threatintel.model.CachingTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * 分层结果缓存
 * <p>
 * 读取顺序 LOCAL → SHARED，SHARED 命中后以相同的绝对过期时间回填 LOCAL。
 * SHARED 中保存 {"expiresAt": ..., "value": ...} 信封，过期判断以信封为准。
 */
@Slf4j
@Service
public class TieredResultCache {

    private final LocalCacheTier localTier;
    private final SharedCacheTier sharedTier;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ThreatIntelProperties.CacheConfig config;
    private final Optional<CacheInvalidationBroadcaster> broadcaster;

    private final Counter localHits;
    private final Counter sharedHits;
    private final Counter misses;

    public TieredResultCache(LocalCacheTier localTier,
                             SharedCacheTier sharedTier,
                             ObjectMapper objectMapper,
                             Clock clock,
                             ThreatIntelProperties properties,
                             MeterRegistry meterRegistry,
                             Optional<CacheInvalidationBroadcaster> broadcaster) {
        this.localTier = localTier;
        this.sharedTier = sharedTier;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.config = properties.getCache();
        this.broadcaster = broadcaster;
        this.localHits = Counter.builder(CacheConstants.METRIC_CACHE_REQUESTS)
            .tag("tier", "local").tag("result", "hit").register(meterRegistry);
        this.sharedHits = Counter.builder(CacheConstants.METRIC_CACHE_REQUESTS)
            .tag("tier", "shared").tag("result", "hit").register(meterRegistry);
        this.misses = Counter.builder(CacheConstants.METRIC_CACHE_REQUESTS)
            .tag("tier", "all").tag("result", "miss").register(meterRegistry);
    }

    /**
     * 读取缓存；tier 为 SHARED 时 LOCAL 未命中会继续查 SHARED
     */
    public <T> Optional<T> get(String key, CacheTier tier, Class<T> type) {
        CacheEntry local = localTier.get(key);
        if (local != null) {
            localHits.increment();
            return Optional.ofNullable(convert(local.value(), type));
        }
        if (tier == CacheTier.SHARED) {
            CacheEntry shared = readShared(key, type);
            if (shared != null) {
                sharedHits.increment();
                localTier.put(shared);
                return Optional.ofNullable(type.cast(shared.value()));
            }
        }
        misses.increment();
        return Optional.empty();
    }

    public void set(String key, Object value, CacheTier tier, Duration ttl) {
        if (value == null) {
            return;
        }
        if (tier == CacheTier.LOCAL) {
            localTier.put(key, value, ttl);
        } else {
            writeShared(key, value, ttl);
        }
    }

    /**
     * LOCAL 层使用默认 TTL
     */
    public void set(String key, Object value) {
        set(key, value, CacheTier.LOCAL, config.getLocalTtl());
    }

    /**
     * 按缓存级别写入：NORMAL 仅 LOCAL；EXTENDED 仅 SHARED；AGGRESSIVE 两层都写
     */
    public void set(String key, Object value, CachingTier cachingTier) {
        Duration ttl = ttlFor(cachingTier);
        switch (cachingTier) {
            case NORMAL -> set(key, value, CacheTier.LOCAL, ttl);
            case EXTENDED -> set(key, value, CacheTier.SHARED, ttl);
            case AGGRESSIVE -> {
                set(key, value, CacheTier.LOCAL, ttl);
                set(key, value, CacheTier.SHARED, ttl);
            }
        }
    }

    public CacheTier readTier(CachingTier cachingTier) {
        return cachingTier == CachingTier.NORMAL ? CacheTier.LOCAL : CacheTier.SHARED;
    }

    public Duration ttlFor(CachingTier cachingTier) {
        return switch (cachingTier) {
            case NORMAL -> config.getNormalTtl();
            case EXTENDED -> config.getExtendedTtl();
            case AGGRESSIVE -> config.getAggressiveTtl();
        };
    }

    public void invalidate(String key) {
        localTier.invalidate(key);
        sharedTier.delete(key);
        broadcaster.ifPresent(b -> b.broadcastLocalInvalidate(key));
    }

    /**
     * 两层同时按 glob 失效，返回删除总数
     */
    public long invalidatePattern(String glob) {
        int local = localTier.invalidatePattern(glob);
        long shared = sharedTier.deletePattern(glob);
        broadcaster.ifPresent(b -> b.broadcastLocalInvalidate(glob));
        log.info("Cache pattern invalidated: pattern={}, local={}, shared={}", glob, local, shared);
        return local + shared;
    }

    /**
     * 仅失效本实例 LOCAL 层，供广播消费者使用
     */
    public int invalidateLocalPattern(String glob) {
        return localTier.invalidatePattern(glob);
    }

    public String key(String organizationId, String segment, String... parts) {
        StringBuilder sb = new StringBuilder(config.getKeyPrefix())
            .append(CacheConstants.KEY_SEPARATOR).append(organizationId)
            .append(CacheConstants.KEY_SEPARATOR).append(segment);
        for (String part : parts) {
            sb.append(CacheConstants.KEY_SEPARATOR).append(part);
        }
        return sb.toString();
    }

    private void writeShared(String key, Object value, Duration ttl) {
        try {
            ObjectNode envelope = objectMapper.createObjectNode();
            envelope.put("expiresAt", clock.millis() + ttl.toMillis());
            envelope.set("value", objectMapper.valueToTree(value));
            sharedTier.set(key, objectMapper.writeValueAsString(envelope), ttl);
        } catch (Exception e) {
            log.warn("Shared cache serialize failed: key={}, error={}", key, e.toString());
        }
    }

    private <T> CacheEntry readShared(String key, Class<T> type) {
        String json = sharedTier.get(key);
        if (json == null) {
            return null;
        }
        try {
            JsonNode envelope = objectMapper.readTree(json);
            long expiresAt = envelope.path("expiresAt").asLong(0L);
            if (expiresAt <= clock.millis()) {
                return null;
            }
            T value = objectMapper.treeToValue(envelope.get("value"), type);
            return new CacheEntry(key, value, CacheTier.SHARED, expiresAt);
        } catch (Exception e) {
            log.warn("Shared cache entry unreadable, treated as miss: key={}, error={}", key, e.toString());
            return null;
        }
    }

    private <T> T convert(Object value, Class<T> type) {
        if (value == null || type.isInstance(value)) {
            return type.cast(value);
        }
        return objectMapper.convertValue(value, type);
    }

    public long localSize() {
        return localTier.size();
    }
}
