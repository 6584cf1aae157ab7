package com.secops.threatintel.monitor;

import com.google.common.collect.EvictingQueue;
import com.secops.threatintel.config.ThreatIntelProperties;
import com.secops.threatintel.constant.CacheConstants;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 查询性能监控
 * <p>
 * 记录每个查询的耗时、缓存命中、批量拉取次数和错误；
 * 结束时按耗时选择日志级别，最近完成的查询保存在定长环形队列中用于统计。
 */
@Component
public class QueryPerformanceMonitor {

    private static final Logger log = LoggerFactory.getLogger(QueryPerformanceMonitor.class);

    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final ThreatIntelProperties.MonitorConfig config;

    private final Map<String, ActiveQuery> activeQueries = new ConcurrentHashMap<>();
    private final EvictingQueue<CompletedQuery> recentQueries;
    private final Counter errorCounter;

    public QueryPerformanceMonitor(Clock clock, MeterRegistry meterRegistry, ThreatIntelProperties properties) {
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.config = properties.getMonitor();
        this.recentQueries = EvictingQueue.create(config.getRecentCapacity());
        this.errorCounter = Counter.builder("threatintel.query.errors")
            .description("Field level errors recorded during query execution")
            .register(meterRegistry);
    }

    /**
     * 开始计时，返回 queryId
     */
    public String startQuery(String name, String organizationId) {
        String queryId = name + "-" + clock.millis() + "-" + UUID.randomUUID().toString().substring(0, 8);
        activeQueries.put(queryId, new ActiveQuery(queryId, name, organizationId, clock.millis()));
        return queryId;
    }

    /**
     * 结束计时并按耗时记录日志；未知 queryId 返回 null
     */
    public CompletedQuery endQuery(String queryId) {
        ActiveQuery active = activeQueries.remove(queryId);
        if (active == null) {
            log.warn("endQuery called for unknown queryId: {}", queryId);
            return null;
        }
        long duration = Math.max(0L, clock.millis() - active.startTime);
        CompletedQuery completed = new CompletedQuery(
            active.queryId, active.name, active.organizationId, active.startTime, duration,
            active.cacheHits.get(), active.cacheMisses.get(), active.dataLoaderBatches.get(),
            List.copyOf(active.errors));

        synchronized (recentQueries) {
            recentQueries.add(completed);
        }

        Timer.builder(CacheConstants.METRIC_QUERY_DURATION)
            .tag("query", active.name)
            .register(meterRegistry)
            .record(duration, TimeUnit.MILLISECONDS);

        logCompletion(completed);
        return completed;
    }

    public void recordCacheHit(String queryId) {
        ActiveQuery active = activeQueries.get(queryId);
        if (active != null) {
            active.cacheHits.incrementAndGet();
        }
    }

    public void recordCacheMiss(String queryId) {
        ActiveQuery active = activeQueries.get(queryId);
        if (active != null) {
            active.cacheMisses.incrementAndGet();
        }
    }

    public void recordDataLoaderBatch(String queryId) {
        ActiveQuery active = activeQueries.get(queryId);
        if (active != null) {
            active.dataLoaderBatches.incrementAndGet();
        }
    }

    public void recordError(String queryId, Throwable error) {
        errorCounter.increment();
        ActiveQuery active = activeQueries.get(queryId);
        if (active != null) {
            active.errors.add(String.valueOf(error.getMessage()));
        }
        log.debug("Query error recorded: queryId={}, error={}", queryId, error.toString());
    }

    /**
     * 进行中查询的缓存命中率
     */
    public double cacheHitRatio(String queryId) {
        ActiveQuery active = activeQueries.get(queryId);
        if (active == null) {
            return 0.0;
        }
        return ratio(active.cacheHits.get(), active.cacheMisses.get());
    }

    /**
     * 包装一段工作：开始、结束计时，异常时记录错误后继续抛出
     */
    public <T> T withMonitoring(String name, String organizationId, Function<String, T> work) {
        String queryId = startQuery(name, organizationId);
        try {
            return work.apply(queryId);
        } catch (RuntimeException e) {
            recordError(queryId, e);
            throw e;
        } finally {
            endQuery(queryId);
        }
    }

    public double getAverageQueryTime(String name) {
        List<CompletedQuery> snapshot = recentSnapshot();
        return snapshot.stream()
            .filter(q -> q.name().equals(name))
            .mapToLong(CompletedQuery::durationMillis)
            .average()
            .orElse(0.0);
    }

    public QueryStats getQueryStats() {
        List<CompletedQuery> snapshot = recentSnapshot();
        long slowThreshold = config.getSlowQueryThreshold().toMillis();
        long totalDuration = 0;
        long slow = 0;
        long hits = 0;
        long misses = 0;
        for (CompletedQuery query : snapshot) {
            totalDuration += query.durationMillis();
            if (query.durationMillis() > slowThreshold) {
                slow++;
            }
            hits += query.cacheHits();
            misses += query.cacheMisses();
        }
        double average = snapshot.isEmpty() ? 0.0 : (double) totalDuration / snapshot.size();
        return new QueryStats(snapshot.size(), average, slow, ratio(hits, misses));
    }

    public int activeQueryCount() {
        return activeQueries.size();
    }

    private List<CompletedQuery> recentSnapshot() {
        synchronized (recentQueries) {
            return new ArrayList<>(recentQueries);
        }
    }

    private void logCompletion(CompletedQuery query) {
        long duration = query.durationMillis();
        if (duration > config.getCriticalQueryThreshold().toMillis()) {
            log.error("Critical slow query: queryId={}, name={}, org={}, duration={}ms, hits={}, misses={}, batches={}, errors={}",
                query.queryId(), query.name(), query.organizationId(), duration,
                query.cacheHits(), query.cacheMisses(), query.dataLoaderBatches(), query.errors().size());
        } else if (duration > config.getSlowQueryThreshold().toMillis()) {
            log.warn("Slow query: queryId={}, name={}, org={}, duration={}ms, hits={}, misses={}",
                query.queryId(), query.name(), query.organizationId(), duration,
                query.cacheHits(), query.cacheMisses());
        } else if (duration > config.getInfoQueryThreshold().toMillis()) {
            log.info("Query completed: queryId={}, name={}, duration={}ms",
                query.queryId(), query.name(), duration);
        } else {
            log.debug("Query completed: queryId={}, name={}, duration={}ms",
                query.queryId(), query.name(), duration);
        }
    }

    private static double ratio(long hits, long misses) {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    private static final class ActiveQuery {
        private final String queryId;
        private final String name;
        private final String organizationId;
        private final long startTime;
        private final AtomicInteger cacheHits = new AtomicInteger();
        private final AtomicInteger cacheMisses = new AtomicInteger();
        private final AtomicInteger dataLoaderBatches = new AtomicInteger();
        private final List<String> errors = new CopyOnWriteArrayList<>();

        private ActiveQuery(String queryId, String name, String organizationId, long startTime) {
            this.queryId = queryId;
            this.name = name;
            this.organizationId = organizationId;
            this.startTime = startTime;
        }
    }

    /**
     * 已完成查询
     */
    public record CompletedQuery(
        String queryId,
        String name,
        String organizationId,
        long startTime,
        long durationMillis,
        int cacheHits,
        int cacheMisses,
        int dataLoaderBatches,
        List<String> errors
    ) {}

    /**
     * 聚合统计
     */
    public record QueryStats(
        long totalQueries,
        double averageQueryTime,
        long slowQueries,
        double cacheHitRatio
    ) {}
}
