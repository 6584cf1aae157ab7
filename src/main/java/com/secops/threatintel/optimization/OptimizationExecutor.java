package com.secops.threatintel.optimization;

import com.secops.threatintel.config.ThreatIntelProperties;
import com.secops.threatintel.constant.FieldCatalog;
import com.secops.threatintel.model.BatchKey;
import com.secops.threatintel.model.BatchingOpportunity;
import com.secops.threatintel.model.CachingTier;
import com.secops.threatintel.model.QueryAnalysis;
import com.secops.threatintel.service.ExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 优化执行器
 * 在解析器运行前按策略配置请求级批量缓存和结果缓存，重复执行结果相同
 */
@Component
public class OptimizationExecutor {

    private static final Logger log = LoggerFactory.getLogger(OptimizationExecutor.class);

    private final ThreatIntelProperties.OptimizerConfig config;

    public OptimizationExecutor(ThreatIntelProperties properties) {
        this.config = properties.getOptimizer();
    }

    public void apply(ExecutionContext context, String rootEntityType, Map<String, Object> rootArguments) {
        QueryAnalysis analysis = context.analysis();
        RequestCacheConfig cacheConfig = context.cacheConfig();

        // 基础配置，各策略在此之上调整
        cacheConfig.setCachingTier(analysis.cachingTier());
        cacheConfig.setParallelExecution(analysis.complexityScore() > config.getParallelExecutionComplexity());
        cacheConfig.setBatchingEnabled(!analysis.batchingOpportunities().isEmpty());

        switch (analysis.strategy()) {
            case AGGRESSIVE_CACHING -> {
                cacheConfig.setCachingTier(CachingTier.AGGRESSIVE);
                prefetchRootEntities(context, rootEntityType, rootArguments);
            }
            case BATCHING_FOCUSED -> {
                cacheConfig.setBatchingEnabled(true);
                tuneBatchSizes(cacheConfig, analysis);
            }
            case DATALOADER_INTENSIVE -> {
                cacheConfig.setParallelExecution(true);
                cacheConfig.setBatchingEnabled(true);
                preRegisterLoaders(context, analysis.relationshipCounts().keySet());
            }
            case STANDARD -> {
                // 使用基础配置
            }
        }

        log.debug("Optimization applied: queryId={}, strategy={}, config={}",
            context.queryId(), analysis.strategy(), cacheConfig.snapshot());
    }

    private void tuneBatchSizes(RequestCacheConfig cacheConfig, QueryAnalysis analysis) {
        for (BatchingOpportunity opportunity : analysis.batchingOpportunities()) {
            int size = opportunity.estimatedBenefit() > config.getHighBenefitThreshold()
                ? config.getHighBenefitBatchSize()
                : config.getStandardBatchSize();
            // 同一字段出现在多个路径时取较大值
            Integer current = cacheConfig.getBatchSize(opportunity.field());
            if (current == null || current < size) {
                cacheConfig.setBatchSize(opportunity.field(), size);
            }
        }
    }

    private void preRegisterLoaders(ExecutionContext context, Collection<String> relationshipFields) {
        for (String field : relationshipFields) {
            FieldCatalog.targetType(field).ifPresent(type -> {
                context.cacheConfig().addPreRegisteredType(type);
                context.batchingCache().register(type);
            });
        }
    }

    private void prefetchRootEntities(ExecutionContext context, String rootEntityType,
                                      Map<String, Object> rootArguments) {
        Set<BatchKey> keys = collectPrefetchKeys(rootEntityType, rootArguments);
        if (keys.isEmpty()) {
            return;
        }
        keys.forEach(context.cacheConfig()::addPrefetchKey);
        context.batchingCache().prefetch(keys);
        log.debug("Prefetch scheduled: queryId={}, keys={}", context.queryId(), keys.size());
    }

    /**
     * 从根参数中提取已知实体 ID
     */
    static Set<BatchKey> collectPrefetchKeys(String rootEntityType, Map<String, Object> rootArguments) {
        Set<BatchKey> keys = new LinkedHashSet<>();
        if (rootArguments == null || rootArguments.isEmpty()) {
            return keys;
        }
        Object ids = rootArguments.get("ids");
        if (rootEntityType != null && ids instanceof Collection<?> idList) {
            for (Object id : idList) {
                if (id != null) {
                    keys.add(new BatchKey(rootEntityType, id.toString()));
                }
            }
        }
        for (Map.Entry<String, String> argument : FieldCatalog.ROOT_ID_ARGUMENTS.entrySet()) {
            Object id = rootArguments.get(argument.getKey());
            if (id != null) {
                keys.add(new BatchKey(argument.getValue(), id.toString()));
            }
        }
        return keys;
    }
}
