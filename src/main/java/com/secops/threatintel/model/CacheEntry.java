package com.secops.threatintel.model;

/**
 * 缓存条目，expiresAt 为绝对过期时间（毫秒）
 */
public record CacheEntry(String key, Object value, CacheTier tier, long expiresAt) {

    public boolean isExpired(long nowMillis) {
        return nowMillis >= expiresAt;
    }

    public long remainingMillis(long nowMillis) {
        return Math.max(0L, expiresAt - nowMillis);
    }

    public CacheEntry withTier(CacheTier newTier) {
        return new CacheEntry(key, value, newTier, expiresAt);
    }
}
