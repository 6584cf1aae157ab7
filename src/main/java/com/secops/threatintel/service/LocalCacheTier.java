package com.secops.threatintel.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.secops.threatintel.model.CacheEntry;
import com.secops.threatintel.model.CacheTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * LOCAL 层：进程内 Caffeine 缓存
 * 同一进程内的并发请求共享，读写由 Caffeine 保证线程安全
 */
@Service
public class LocalCacheTier {

    private static final Logger log = LoggerFactory.getLogger(LocalCacheTier.class);

    private final Cache<String, CacheEntry> resultLocalCache;
    private final Clock clock;

    public LocalCacheTier(@Qualifier("resultLocalCache") Cache<String, CacheEntry> resultLocalCache,
                          Clock clock) {
        this.resultLocalCache = resultLocalCache;
        this.clock = clock;
    }

    /**
     * 获取未过期条目，过期条目顺带清除
     */
    public CacheEntry get(String key) {
        CacheEntry entry = resultLocalCache.getIfPresent(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.millis())) {
            resultLocalCache.invalidate(key);
            return null;
        }
        return entry;
    }

    public void put(String key, Object value, Duration ttl) {
        put(new CacheEntry(key, value, CacheTier.LOCAL, clock.millis() + ttl.toMillis()));
    }

    /**
     * 按条目自带的 expiresAt 写入（SHARED 回填使用）
     */
    public void put(CacheEntry entry) {
        if (entry.isExpired(clock.millis())) {
            return;
        }
        resultLocalCache.put(entry.key(), entry.withTier(CacheTier.LOCAL));
    }

    public void invalidate(String key) {
        resultLocalCache.invalidate(key);
    }

    /**
     * 按 glob 模式失效，返回删除数量
     */
    public int invalidatePattern(String glob) {
        Pattern pattern = Pattern.compile(globToRegex(glob));
        int[] removed = {0};
        resultLocalCache.asMap().keySet().removeIf(key -> {
            boolean match = pattern.matcher(key).matches();
            if (match) {
                removed[0]++;
            }
            return match;
        });
        log.debug("Local pattern invalidated: pattern={}, removed={}", glob, removed[0]);
        return removed[0];
    }

    public void invalidateAll() {
        resultLocalCache.invalidateAll();
    }

    public long size() {
        return resultLocalCache.estimatedSize();
    }

    public CacheStats stats() {
        return resultLocalCache.stats();
    }

    /**
     * Redis glob 转正则：* 任意串，? 单字符，[...] 字符类，其余字符按字面量
     */
    static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        boolean inClass = false;
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (inClass) {
                if (c == ']') {
                    inClass = false;
                }
                if (c == '\\') {
                    regex.append("\\\\");
                } else {
                    regex.append(c);
                }
                continue;
            }
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    inClass = true;
                    regex.append('[');
                }
                case '\\' -> {
                    if (i + 1 < glob.length()) {
                        regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
                    }
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }
}
