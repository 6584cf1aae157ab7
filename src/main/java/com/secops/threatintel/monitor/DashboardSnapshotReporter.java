package com.secops.threatintel.monitor;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.secops.threatintel.service.LocalCacheTier;
import com.secops.threatintel.subscription.SubscriptionDispatcher;
import com.secops.threatintel.subscription.SubscriptionRateLimiter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 仪表盘快照
 * 活跃订阅数、限流拒绝数、缓存命中率等定期写入日志并以 Gauge 暴露
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DashboardSnapshotReporter {

    private final SubscriptionDispatcher dispatcher;
    private final SubscriptionRateLimiter rateLimiter;
    private final QueryPerformanceMonitor queryMonitor;
    private final LocalCacheTier localCacheTier;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @PostConstruct
    public void registerGauges() {
        Gauge.builder("threatintel.dashboard.rate_limit_rejections", rateLimiter, SubscriptionRateLimiter::totalRejections)
            .description("Total rate limit rejections")
            .register(meterRegistry);
        Gauge.builder("threatintel.dashboard.cache_hit_ratio", queryMonitor, m -> m.getQueryStats().cacheHitRatio())
            .description("Cache hit ratio over recent queries")
            .register(meterRegistry);
        Gauge.builder("threatintel.dashboard.average_query_ms", queryMonitor, m -> m.getQueryStats().averageQueryTime())
            .description("Average query time over recent queries")
            .register(meterRegistry);
    }

    public DashboardSnapshot snapshot() {
        QueryPerformanceMonitor.QueryStats stats = queryMonitor.getQueryStats();
        return new DashboardSnapshot(
            dispatcher.activeRegistrations(),
            rateLimiter.totalRejections(),
            stats.cacheHitRatio(),
            stats.totalQueries(),
            stats.averageQueryTime(),
            stats.slowQueries(),
            clock.millis()
        );
    }

    /**
     * 每分钟输出一次快照
     */
    @Scheduled(fixedRateString = "${threatintel.monitor.dashboard-interval:60000}")
    public void report() {
        DashboardSnapshot snapshot = snapshot();
        log.info("Dashboard snapshot: activeSubscriptions={}, rateLimitRejections={}, cacheHitRatio={}, " +
                "totalQueries={}, avgQueryMs={}, slowQueries={}",
            snapshot.activeSubscriptions(), snapshot.rateLimitRejections(),
            String.format("%.2f%%", snapshot.cacheHitRatio() * 100),
            snapshot.totalQueries(), String.format("%.1f", snapshot.averageQueryTime()),
            snapshot.slowQueries());

        CacheStats local = localCacheTier.stats();
        log.info("Local cache stats: size={}, hitRate={}, evictions={}",
            localCacheTier.size(), String.format("%.2f%%", local.hitRate() * 100), local.evictionCount());
    }

    public record DashboardSnapshot(
        int activeSubscriptions,
        long rateLimitRejections,
        double cacheHitRatio,
        long totalQueries,
        double averageQueryTime,
        long slowQueries,
        long timestamp
    ) {}
}
