package com.secops.threatintel.service;

import com.secops.threatintel.config.ThreatIntelProperties;
import com.secops.threatintel.constant.CacheConstants;
import com.secops.threatintel.model.CacheTier;
import com.secops.threatintel.model.ThreatEntity;
import com.secops.threatintel.monitor.QueryPerformanceMonitor;
import com.secops.threatintel.optimization.RequestCacheConfig;
import com.secops.threatintel.repository.StorageAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 为每个请求创建 {@link BatchingCache}
 * 批量拉取先查分层结果缓存，只把未命中的 ID 交给存储适配器，并丢弃不属于本组织的实体
 */
@Slf4j
@Component
public class BatchingCacheFactory {

    private final StorageAdapter storageAdapter;
    private final TieredResultCache tieredResultCache;
    private final QueryPerformanceMonitor monitor;
    private final ScheduledExecutorService dispatchScheduler;
    private final ExecutorService fetchExecutor;
    private final ThreatIntelProperties.OptimizerConfig config;

    public BatchingCacheFactory(StorageAdapter storageAdapter,
                                TieredResultCache tieredResultCache,
                                QueryPerformanceMonitor monitor,
                                @Qualifier("batchDispatchScheduler") ScheduledExecutorService dispatchScheduler,
                                @Qualifier("storageFetchExecutor") ExecutorService fetchExecutor,
                                ThreatIntelProperties properties) {
        this.storageAdapter = storageAdapter;
        this.tieredResultCache = tieredResultCache;
        this.monitor = monitor;
        this.dispatchScheduler = dispatchScheduler;
        this.fetchExecutor = fetchExecutor;
        this.config = properties.getOptimizer();
    }

    public BatchingCache create(String organizationId, String queryId, RequestCacheConfig cacheConfig) {
        EntityFetcher fetcher = (entityType, ids) -> fetch(organizationId, queryId, cacheConfig, entityType, ids);
        return new BatchingCache(fetcher, cacheConfig, dispatchScheduler, fetchExecutor,
            config.getBatchWindow().toMillis(), config.getDefaultMaxBatchSize());
    }

    private List<ThreatEntity> fetch(String organizationId, String queryId, RequestCacheConfig cacheConfig,
                                     String entityType, List<String> ids) {
        monitor.recordDataLoaderBatch(queryId);
        CacheTier readTier = tieredResultCache.readTier(cacheConfig.getCachingTier());

        List<ThreatEntity> result = new ArrayList<>(ids.size());
        List<String> missing = new ArrayList<>();
        for (String id : ids) {
            Optional<ThreatEntity> cached = tieredResultCache.get(
                entityKey(organizationId, entityType, id), readTier, ThreatEntity.class);
            if (cached.isPresent()) {
                monitor.recordCacheHit(queryId);
                result.add(cached.get());
            } else {
                monitor.recordCacheMiss(queryId);
                missing.add(id);
            }
        }
        if (missing.isEmpty()) {
            return result;
        }

        List<ThreatEntity> fetched = storageAdapter.fetchByIds(entityType, missing);
        for (ThreatEntity entity : fetched) {
            if (!organizationId.equals(entity.getOrganizationId())) {
                log.warn("Dropped entity from foreign organization: type={}, id={}, queryId={}",
                    entityType, entity.getId(), queryId);
                continue;
            }
            result.add(entity);
            tieredResultCache.set(entityKey(organizationId, entityType, entity.getId()), entity,
                cacheConfig.getCachingTier());
        }
        log.debug("Batch fetched: queryId={}, type={}, requested={}, fromStorage={}",
            queryId, entityType, ids.size(), missing.size());
        return result;
    }

    public String entityKey(String organizationId, String entityType, String id) {
        return tieredResultCache.key(organizationId, CacheConstants.ENTITY_SEGMENT, entityType, id);
    }
}
