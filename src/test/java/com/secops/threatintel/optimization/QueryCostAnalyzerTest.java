package com.secops.threatintel.optimization;

import com.secops.threatintel.config.ThreatIntelProperties;
import com.secops.threatintel.model.BatchingOpportunity;
import com.secops.threatintel.model.CachingTier;
import com.secops.threatintel.model.ExecutionStrategy;
import com.secops.threatintel.model.FieldSelection;
import com.secops.threatintel.model.QueryAnalysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.secops.threatintel.model.FieldSelection.leaf;
import static com.secops.threatintel.model.FieldSelection.of;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 查询成本分析器单元测试
 */
class QueryCostAnalyzerTest {

    private QueryCostAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new QueryCostAnalyzer(new StrategySelector(new ThreatIntelProperties()));
    }

    @Test
    @DisplayName("空字段树返回零值分析")
    void testEmptySelection() {
        QueryAnalysis analysis = analyzer.analyze(List.of());

        assertEquals(0, analysis.complexityScore());
        assertTrue(analysis.requestedFields().isEmpty());
        assertTrue(analysis.relationshipCounts().isEmpty());
        assertTrue(analysis.batchingOpportunities().isEmpty());
        assertEquals(ExecutionStrategy.STANDARD, analysis.strategy());
        assertEquals(CachingTier.NORMAL, analysis.cachingTier());
    }

    @Test
    @DisplayName("路径、关系字段计数与批量机会")
    void testPathsAndRelationships() {
        QueryAnalysis analysis = analyzer.analyze(List.of(
            leaf("id"),
            leaf("name"),
            of("indicators", leaf("id"), leaf("value")),
            of("relatedThreats", leaf("id"), of("indicators", leaf("id")))
        ));

        assertEquals(Set.of("id", "name", "indicators", "indicators.id", "indicators.value",
            "relatedThreats", "relatedThreats.id", "relatedThreats.indicators",
            "relatedThreats.indicators.id"), analysis.requestedFields());
        assertEquals(Map.of("indicators", 2, "relatedThreats", 1), analysis.relationshipCounts());
        // id(1)+name(1)+indicators(5)+id(1)+value(2)+relatedThreats(10)+id(1)+indicators(5)+id(1)
        assertEquals(27, analysis.complexityScore());

        List<String> opportunityPaths = analysis.batchingOpportunities().stream()
            .map(BatchingOpportunity::path).toList();
        assertEquals(List.of("indicators", "relatedThreats.indicators"), opportunityPaths);
        assertEquals(0.9, analysis.batchingOpportunities().get(0).estimatedBenefit());
    }

    @Test
    @DisplayName("增加字段不会降低复杂度")
    void testMonotonicScore() {
        List<FieldSelection> fields = new ArrayList<>();
        int previous = 0;
        for (String name : List.of("id", "severity", "campaigns", "mitigations", "unknownField", "analytics")) {
            fields.add(leaf(name));
            int score = analyzer.analyze(fields).complexityScore();
            assertTrue(score >= previous, "score dropped after adding " + name);
            previous = score;
        }
    }

    @Test
    @DisplayName("6 种非批量关系字段选择 DATALOADER_INTENSIVE")
    void testDataLoaderIntensive() {
        QueryAnalysis analysis = analyzer.analyze(List.of(
            leaf("relatedThreats"), leaf("mitigations"), leaf("reports"),
            leaf("matches"), leaf("sightings"), leaf("correlationMatches")
        ));

        assertEquals(60, analysis.complexityScore());
        assertEquals(6, analysis.relationshipCounts().size());
        assertTrue(analysis.batchingOpportunities().isEmpty());
        assertEquals(ExecutionStrategy.DATALOADER_INTENSIVE, analysis.strategy());
        assertEquals(CachingTier.EXTENDED, analysis.cachingTier());
    }

    @Test
    @DisplayName("4 个批量机会选择 BATCHING_FOCUSED")
    void testBatchingFocused() {
        QueryAnalysis analysis = analyzer.analyze(List.of(
            leaf("indicators"), leaf("threatActors"), leaf("campaigns"), leaf("tools")
        ));

        assertEquals(4, analysis.batchingOpportunities().size());
        assertEquals(ExecutionStrategy.BATCHING_FOCUSED, analysis.strategy());
    }

    @Test
    @DisplayName("复杂度超过 100 的分析查询选择 AGGRESSIVE_CACHING")
    void testAggressiveCaching() {
        QueryAnalysis analysis = analyzer.analyze(List.of(
            leaf("analytics"), leaf("dashboard"), leaf("attribution"), leaf("enrichment"),
            leaf("sightings"), leaf("relatedThreats"), leaf("correlationMatches")
        ));

        assertEquals(127, analysis.complexityScore());
        assertEquals(ExecutionStrategy.AGGRESSIVE_CACHING, analysis.strategy());
        assertEquals(CachingTier.AGGRESSIVE, analysis.cachingTier());
    }

    @Test
    @DisplayName("从解码后的嵌套 Map 构建字段树")
    void testFromTree() {
        Map<String, Object> indicators = new LinkedHashMap<>();
        indicators.put("id", true);
        indicators.put("value", null);
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("id", true);
        tree.put("indicators", indicators);

        QueryAnalysis analysis = analyzer.analyze(FieldSelection.fromTree(tree));

        assertEquals(Set.of("id", "indicators", "indicators.id", "indicators.value"), analysis.requestedFields());
    }

    @Test
    @DisplayName("分析结果不可修改")
    void testAnalysisIsImmutable() {
        QueryAnalysis analysis = analyzer.analyze(List.of(leaf("indicators")));

        assertThrows(UnsupportedOperationException.class, () -> analysis.requestedFields().add("x"));
        assertThrows(UnsupportedOperationException.class, () -> analysis.relationshipCounts().put("x", 1));
        assertThrows(UnsupportedOperationException.class, () -> analysis.batchingOpportunities().clear());
    }
}
