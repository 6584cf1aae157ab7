package com.secops.threatintel.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单次读请求的成本分析结果，创建后不可变
 */
public record QueryAnalysis(
    Set<String> requestedFields,
    Map<String, Integer> relationshipCounts,
    int complexityScore,
    ExecutionStrategy strategy,
    List<BatchingOpportunity> batchingOpportunities,
    CachingTier cachingTier
) {

    public QueryAnalysis {
        requestedFields = Collections.unmodifiableSet(new LinkedHashSet<>(requestedFields));
        relationshipCounts = Collections.unmodifiableMap(new LinkedHashMap<>(relationshipCounts));
        batchingOpportunities = List.copyOf(batchingOpportunities);
    }

    public static QueryAnalysis empty() {
        return new QueryAnalysis(Set.of(), Map.of(), 0, ExecutionStrategy.STANDARD,
            List.of(), CachingTier.NORMAL);
    }
}
