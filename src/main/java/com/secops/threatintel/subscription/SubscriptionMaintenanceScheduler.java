package com.secops.threatintel.subscription;

import com.secops.threatintel.config.ThreatIntelProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 订阅后台清理任务
 * 限流窗口清理与陈旧订阅清理由同一个调度器持有，关闭时一起取消
 */
@Component
public class SubscriptionMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionMaintenanceScheduler.class);

    private final SubscriptionRateLimiter rateLimiter;
    private final SubscriptionHealthMonitor healthMonitor;
    private final SubscriptionDispatcher dispatcher;
    private final ThreatIntelProperties.SubscriptionConfig config;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> windowSweep;
    private ScheduledFuture<?> staleSweep;

    public SubscriptionMaintenanceScheduler(SubscriptionRateLimiter rateLimiter,
                                            SubscriptionHealthMonitor healthMonitor,
                                            SubscriptionDispatcher dispatcher,
                                            ThreatIntelProperties properties) {
        this.rateLimiter = rateLimiter;
        this.healthMonitor = healthMonitor;
        this.dispatcher = dispatcher;
        this.config = properties.getSubscription();
    }

    @PostConstruct
    public void start() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "subscription-maintenance");
            t.setDaemon(true);
            return t;
        });
        long interval = config.getSweepInterval().toMillis();
        windowSweep = scheduler.scheduleAtFixedRate(this::sweepRateLimitWindows, interval, interval, TimeUnit.MILLISECONDS);
        staleSweep = scheduler.scheduleAtFixedRate(this::sweepStaleSubscriptions, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Subscription maintenance started: interval={}ms, staleAfter={}, windowRetention={}",
            interval, config.getStaleAfter(), config.getWindowRetention());
    }

    void sweepRateLimitWindows() {
        try {
            rateLimiter.cleanupExpiredWindows(config.getWindowRetention());
        } catch (Exception e) {
            log.error("Rate limit window sweep failed", e);
        }
    }

    void sweepStaleSubscriptions() {
        try {
            long maxAge = config.getStaleAfter().toMillis();
            // 先移除登记（其 untrack 会递减计数），再清理剩余的元数据
            int registrations = dispatcher.evictStale(maxAge);
            int metadata = healthMonitor.cleanupStaleSubscriptions(maxAge);
            if (metadata > 0 || registrations > 0) {
                log.info("Stale subscription sweep: metadataRemoved={}, registrationsEvicted={}",
                    metadata, registrations);
            }
        } catch (Exception e) {
            log.error("Stale subscription sweep failed", e);
        }
    }

    public boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    @PreDestroy
    public void stop() {
        if (windowSweep != null) {
            windowSweep.cancel(false);
        }
        if (staleSweep != null) {
            staleSweep.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Subscription maintenance stopped");
    }
}
