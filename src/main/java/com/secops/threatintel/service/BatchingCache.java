package com.secops.threatintel.service;

import com.secops.threatintel.model.BatchKey;
import com.secops.threatintel.model.ThreatEntity;
import com.secops.threatintel.optimization.RequestCacheConfig;
import org.dataloader.BatchLoader;
import org.dataloader.DataLoader;
import org.dataloader.DataLoaderFactory;
import org.dataloader.DataLoaderOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 请求级批量缓存
 * <p>
 * 每种实体类型一个 DataLoader，首次使用时按请求配置创建。
 * 同一微批窗口内发起的加载合并为一次下游拉取；DataLoader 自带的缓存保证
 * 同一请求内同一个 (entityType, id) 最多拉取一次。实例只属于一个请求，不跨请求共享。
 */
public class BatchingCache {

    private static final Logger log = LoggerFactory.getLogger(BatchingCache.class);

    private final EntityFetcher fetcher;
    private final RequestCacheConfig config;
    private final ScheduledExecutorService dispatchScheduler;
    private final Executor fetchExecutor;
    private final long windowMillis;
    private final int defaultMaxBatchSize;

    private final Map<String, DataLoader<String, ThreatEntity>> loaders = new ConcurrentHashMap<>();
    private final Map<String, AtomicBoolean> dispatchPending = new ConcurrentHashMap<>();
    private final AtomicInteger fetchCount = new AtomicInteger();

    public BatchingCache(EntityFetcher fetcher,
                         RequestCacheConfig config,
                         ScheduledExecutorService dispatchScheduler,
                         Executor fetchExecutor,
                         long windowMillis,
                         int defaultMaxBatchSize) {
        this.fetcher = fetcher;
        this.config = config;
        this.dispatchScheduler = dispatchScheduler;
        this.fetchExecutor = fetchExecutor;
        this.windowMillis = windowMillis;
        this.defaultMaxBatchSize = defaultMaxBatchSize;
    }

    public CompletableFuture<ThreatEntity> load(String entityType, String id) {
        CompletableFuture<ThreatEntity> future = loader(entityType).load(id);
        scheduleDispatch(entityType);
        return future;
    }

    public CompletableFuture<List<ThreatEntity>> loadMany(String entityType, List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        CompletableFuture<List<ThreatEntity>> future = loader(entityType).loadMany(ids);
        scheduleDispatch(entityType);
        return future;
    }

    /**
     * 预取：按类型分组发起加载，不等待结果
     */
    public void prefetch(Collection<BatchKey> keys) {
        Map<String, List<String>> byType = keys.stream()
            .collect(Collectors.groupingBy(BatchKey::entityType,
                Collectors.mapping(BatchKey::id, Collectors.toList())));
        byType.forEach(this::loadMany);
    }

    /**
     * 同进程内写入该实体后调用，下次加载重新拉取
     */
    public void clear(BatchKey key) {
        DataLoader<String, ThreatEntity> loader = loaders.get(key.entityType());
        if (loader != null) {
            loader.clear(key.id());
        }
    }

    /**
     * 用已知值填充，后续加载不再拉取
     */
    public void prime(BatchKey key, ThreatEntity entity) {
        loader(key.entityType()).prime(key.id(), entity);
    }

    /**
     * 提前创建该类型的加载器
     */
    public void register(String entityType) {
        loader(entityType);
    }

    public Set<String> registeredTypes() {
        return Set.copyOf(loaders.keySet());
    }

    /**
     * 下游拉取次数
     */
    public int fetchCount() {
        return fetchCount.get();
    }

    /**
     * 立即派发所有待处理的加载
     */
    public void dispatchAll() {
        loaders.values().forEach(DataLoader::dispatch);
    }

    private DataLoader<String, ThreatEntity> loader(String entityType) {
        return loaders.computeIfAbsent(entityType, this::createLoader);
    }

    private DataLoader<String, ThreatEntity> createLoader(String entityType) {
        int maxBatchSize = config.maxBatchSizeFor(entityType, defaultMaxBatchSize);
        DataLoaderOptions options = DataLoaderOptions.newOptions()
            .setBatchingEnabled(config.isBatchingEnabled())
            .setCachingEnabled(true)
            .setMaxBatchSize(maxBatchSize);
        BatchLoader<String, ThreatEntity> batchLoader = keys ->
            CompletableFuture.supplyAsync(() -> fetchBatch(entityType, keys), fetchExecutor);
        log.debug("DataLoader created: type={}, maxBatchSize={}, batching={}",
            entityType, maxBatchSize, config.isBatchingEnabled());
        return DataLoaderFactory.newDataLoader(batchLoader, options);
    }

    private List<ThreatEntity> fetchBatch(String entityType, List<String> ids) {
        fetchCount.incrementAndGet();
        List<ThreatEntity> fetched = fetcher.fetch(entityType, ids);
        Map<String, ThreatEntity> byId = new HashMap<>();
        if (fetched != null) {
            for (ThreatEntity entity : fetched) {
                if (entity != null) {
                    byId.put(entity.getId(), entity);
                }
            }
        }
        // DataLoader 要求结果与 key 一一对应
        List<ThreatEntity> ordered = new ArrayList<>(ids.size());
        for (String id : ids) {
            ordered.add(byId.get(id));
        }
        return ordered;
    }

    private void scheduleDispatch(String entityType) {
        AtomicBoolean pending = dispatchPending.computeIfAbsent(entityType, k -> new AtomicBoolean());
        if (!pending.compareAndSet(false, true)) {
            return;
        }
        Runnable dispatch = () -> {
            pending.set(false);
            loaders.get(entityType).dispatch();
        };
        try {
            dispatchScheduler.schedule(dispatch, windowMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Batch dispatch scheduler rejected, dispatching inline: type={}", entityType);
            dispatch.run();
        }
    }
}
