package com.secops.threatintel.subscription;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 按 (organizationId, topic) 的分钟级固定窗口限流
 * 超限事件直接丢弃，不排队不重试
 */
@Slf4j
@Component
public class SubscriptionRateLimiter {

    private static final long WINDOW_MILLIS = 60_000L;

    private final Clock clock;
    private final Map<WindowKey, RateLimitWindow> windows = new ConcurrentHashMap<>();
    private final AtomicLong rejections = new AtomicLong();
    private final Counter rejectionCounter;

    public SubscriptionRateLimiter(Clock clock, MeterRegistry meterRegistry) {
        this.clock = clock;
        this.rejectionCounter = Counter.builder("threatintel.subscription.rate_limited")
            .description("Events rejected by the per organization topic rate limiter")
            .register(meterRegistry);
    }

    public boolean checkLimit(String organizationId, String topic, int maxPerMinute) {
        if (maxPerMinute <= 0) {
            recordRejection(organizationId, topic);
            return false;
        }
        long windowStart = floorToMinute(clock.millis());
        boolean[] allowed = {false};
        windows.compute(new WindowKey(organizationId, topic), (key, current) -> {
            if (current == null || current.windowStart() != windowStart) {
                allowed[0] = true;
                return new RateLimitWindow(organizationId, topic, windowStart, 1);
            }
            if (current.count() < maxPerMinute) {
                allowed[0] = true;
                return current.increment();
            }
            return current;
        });
        if (!allowed[0]) {
            recordRejection(organizationId, topic);
        }
        return allowed[0];
    }

    /**
     * 清理早于 retention 的窗口，返回清理数量
     */
    public int cleanupExpiredWindows(Duration retention) {
        long cutoff = clock.millis() - retention.toMillis();
        int before = windows.size();
        windows.values().removeIf(window -> window.windowStart() < cutoff);
        int removed = before - windows.size();
        if (removed > 0) {
            log.debug("Rate limit windows cleaned: removed={}, remaining={}", removed, windows.size());
        }
        return Math.max(removed, 0);
    }

    public RateLimitWindow currentWindow(String organizationId, String topic) {
        return windows.get(new WindowKey(organizationId, topic));
    }

    public int windowCount() {
        return windows.size();
    }

    public long totalRejections() {
        return rejections.get();
    }

    private void recordRejection(String organizationId, String topic) {
        rejections.incrementAndGet();
        rejectionCounter.increment();
        log.debug("Rate limit exceeded: org={}, topic={}", organizationId, topic);
    }

    static long floorToMinute(long epochMillis) {
        return epochMillis - Math.floorMod(epochMillis, WINDOW_MILLIS);
    }

    private record WindowKey(String organizationId, String topic) {}
}
