package com.secops.threatintel.optimization;

import com.secops.threatintel.constant.FieldCatalog;
import com.secops.threatintel.model.BatchingOpportunity;
import com.secops.threatintel.model.CachingTier;
import com.secops.threatintel.model.ExecutionStrategy;
import com.secops.threatintel.model.FieldSelection;
import com.secops.threatintel.model.QueryAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 查询成本分析器
 * 深度优先遍历请求字段树，累计复杂度、关系字段和批量机会，
 * 并交给 {@link StrategySelector} 决定策略与缓存级别
 */
@Slf4j
@Component
public class QueryCostAnalyzer {

    private final StrategySelector strategySelector;

    public QueryCostAnalyzer(StrategySelector strategySelector) {
        this.strategySelector = strategySelector;
    }

    public QueryAnalysis analyze(List<FieldSelection> selections) {
        if (selections == null || selections.isEmpty()) {
            return QueryAnalysis.empty();
        }

        Walk walk = new Walk();
        for (FieldSelection selection : selections) {
            walk.visit(selection, "");
        }

        ExecutionStrategy strategy = strategySelector.selectStrategy(
            walk.complexity, walk.opportunities.size(), walk.relationshipCounts.size());
        CachingTier tier = strategySelector.selectCachingTier(walk.paths, walk.complexity);

        QueryAnalysis analysis = new QueryAnalysis(walk.paths, walk.relationshipCounts,
            walk.complexity, strategy, walk.opportunities, tier);

        log.debug("Query analyzed: complexity={}, relationships={}, opportunities={}, strategy={}, tier={}",
            analysis.complexityScore(), analysis.relationshipCounts().size(),
            analysis.batchingOpportunities().size(), strategy, tier);
        return analysis;
    }

    /**
     * 单次遍历的累加状态
     */
    private static final class Walk {
        private final Set<String> paths = new LinkedHashSet<>();
        private final Map<String, Integer> relationshipCounts = new LinkedHashMap<>();
        private final List<BatchingOpportunity> opportunities = new ArrayList<>();
        private int complexity;

        void visit(FieldSelection field, String parentPath) {
            String name = field.name();
            String path = parentPath.isEmpty() ? name : parentPath + "." + name;
            paths.add(path);

            if (FieldCatalog.isRelationship(name)) {
                relationshipCounts.merge(name, 1, Integer::sum);
                if (FieldCatalog.isBatchable(name)) {
                    opportunities.add(new BatchingOpportunity(name, path, FieldCatalog.batchBenefit(name)));
                }
            }

            complexity += FieldCatalog.weight(name);

            for (FieldSelection child : field.selections()) {
                visit(child, path);
            }
        }
    }
}
