package com.secops.threatintel.service;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * SHARED 层：Redis 分布式缓存
 * 所有调用经过熔断器；任何失败都记录日志并按未命中处理，不向调用方抛出
 */
@Service
public class SharedCacheTier {

    private static final Logger log = LoggerFactory.getLogger(SharedCacheTier.class);

    static final int SCAN_BATCH = 500;

    private final StringRedisTemplate redisTemplate;
    private final CircuitBreaker circuitBreaker;

    public SharedCacheTier(StringRedisTemplate redisTemplate, CircuitBreaker sharedCacheCircuitBreaker) {
        this.redisTemplate = redisTemplate;
        this.circuitBreaker = sharedCacheCircuitBreaker;
    }

    /**
     * 获取缓存，失败返回 null
     */
    public String get(String key) {
        try {
            return circuitBreaker.executeSupplier(() -> redisTemplate.opsForValue().get(key));
        } catch (Exception e) {
            log.warn("Shared cache get failed, treated as miss: key={}, error={}", key, e.toString());
            return null;
        }
    }

    public void set(String key, String value, Duration ttl) {
        try {
            circuitBreaker.executeRunnable(() -> redisTemplate.opsForValue().set(key, value, ttl));
        } catch (Exception e) {
            log.warn("Shared cache set failed: key={}, error={}", key, e.toString());
        }
    }

    public void delete(String key) {
        try {
            circuitBreaker.executeRunnable(() -> redisTemplate.delete(key));
        } catch (Exception e) {
            log.warn("Shared cache delete failed: key={}, error={}", key, e.toString());
        }
    }

    /**
     * 按 glob 模式删除，返回删除数量
     * 用 SCAN 增量遍历，每 {@value #SCAN_BATCH} 个键删除一次
     */
    public long deletePattern(String glob) {
        try {
            Long deleted = circuitBreaker.executeSupplier(() -> scanAndDelete(glob));
            return deleted == null ? 0L : deleted;
        } catch (Exception e) {
            log.warn("Shared cache pattern delete failed: pattern={}, error={}", glob, e.toString());
            return 0L;
        }
    }

    private long scanAndDelete(String glob) {
        ScanOptions options = ScanOptions.scanOptions().match(glob).count(SCAN_BATCH).build();
        long removed = 0;
        List<String> batch = new ArrayList<>(SCAN_BATCH);
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() >= SCAN_BATCH) {
                    removed += deleteBatch(batch);
                    batch.clear();
                }
            }
        }
        removed += deleteBatch(batch);
        return removed;
    }

    private long deleteBatch(List<String> keys) {
        if (keys.isEmpty()) {
            return 0L;
        }
        Long deleted = redisTemplate.delete(keys);
        return deleted == null ? 0L : deleted;
    }

    public boolean ping() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (Exception e) {
            log.warn("Shared cache ping failed: {}", e.toString());
            return false;
        }
    }

    public String circuitState() {
        return circuitBreaker.getState().name();
    }
}
