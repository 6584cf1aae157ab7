package com.secops.threatintel.optimization;

import com.secops.threatintel.config.ThreatIntelProperties;
import com.secops.threatintel.constant.FieldCatalog;
import com.secops.threatintel.model.CachingTier;
import com.secops.threatintel.model.ExecutionStrategy;
import com.secops.threatintel.model.QueryAnalysis;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * 策略选择器
 * 纯函数：相同的 (复杂度, 批量机会数, 关系字段种类数) 总是得到相同策略
 */
@Component
public class StrategySelector {

    private final ThreatIntelProperties.OptimizerConfig config;

    public StrategySelector(ThreatIntelProperties properties) {
        this.config = properties.getOptimizer();
    }

    /**
     * 按优先级选择执行策略，先匹配者生效
     */
    public ExecutionStrategy selectStrategy(int complexityScore, int opportunityCount, int relationshipKinds) {
        if (complexityScore > config.getAggressiveCachingComplexity()) {
            return ExecutionStrategy.AGGRESSIVE_CACHING;
        }
        if (opportunityCount > config.getBatchingFocusedOpportunities()) {
            return ExecutionStrategy.BATCHING_FOCUSED;
        }
        if (relationshipKinds > config.getDataloaderRelationships()) {
            return ExecutionStrategy.DATALOADER_INTENSIVE;
        }
        return ExecutionStrategy.STANDARD;
    }

    public ExecutionStrategy selectStrategy(QueryAnalysis analysis) {
        return selectStrategy(analysis.complexityScore(),
            analysis.batchingOpportunities().size(),
            analysis.relationshipCounts().size());
    }

    /**
     * 缓存级别与执行策略相互独立
     */
    public CachingTier selectCachingTier(Collection<String> requestedPaths, int complexityScore) {
        for (String path : requestedPaths) {
            if (FieldCatalog.isExpensivePath(path)) {
                return CachingTier.AGGRESSIVE;
            }
        }
        if (complexityScore > config.getExtendedCachingComplexity()) {
            return CachingTier.EXTENDED;
        }
        return CachingTier.NORMAL;
    }
}
