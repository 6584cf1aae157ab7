package com.secops.threatintel.constant;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 威胁情报字段注册表
 * 包括关系字段、可批量字段、字段权重和昂贵分析字段
 */
public final class FieldCatalog {

    private FieldCatalog() {}

    /** 未登记字段的权重 */
    public static final int DEFAULT_WEIGHT = 2;

    /** 未登记可批量字段的收益 */
    public static final double DEFAULT_BATCH_BENEFIT = 0.2;

    /** 关系字段 -> 目标实体类型 */
    private static final Map<String, String> RELATIONSHIP_TARGETS = Map.ofEntries(
        Map.entry("threatActors", "actor"),
        Map.entry("campaigns", "campaign"),
        Map.entry("indicators", "ioc"),
        Map.entry("iocs", "ioc"),
        Map.entry("relatedThreats", "threat"),
        Map.entry("mitigations", "mitigation"),
        Map.entry("reports", "report"),
        Map.entry("malwareFamilies", "malware"),
        Map.entry("tools", "tool"),
        Map.entry("sources", "source"),
        Map.entry("feeds", "feed"),
        Map.entry("matches", "match"),
        Map.entry("sightings", "sighting"),
        Map.entry("relatedIOCs", "ioc"),
        Map.entry("correlationMatches", "correlation")
    );

    /** 可批量字段及其收益估计 */
    private static final Map<String, Double> BATCH_BENEFITS = Map.of(
        "indicators", 0.9,
        "iocs", 0.9,
        "threatActors", 0.8,
        "campaigns", 0.7,
        "malwareFamilies", 0.6,
        "tools", 0.5,
        "sources", 0.4,
        "feeds", 0.3
    );

    private static final Map<String, Integer> WEIGHTS = Map.ofEntries(
        // 标量
        Map.entry("id", 1),
        Map.entry("name", 1),
        Map.entry("title", 1),
        Map.entry("type", 1),
        Map.entry("status", 1),
        Map.entry("confidence", 1),
        Map.entry("severity", 1),
        Map.entry("description", 2),
        Map.entry("tags", 2),
        Map.entry("sources", 3),
        Map.entry("metadata", 3),
        Map.entry("context", 3),
        // 关系
        Map.entry("indicators", 5),
        Map.entry("iocs", 5),
        Map.entry("mitigations", 6),
        Map.entry("malwareFamilies", 6),
        Map.entry("reports", 7),
        Map.entry("threatActors", 8),
        Map.entry("campaigns", 8),
        Map.entry("relatedThreats", 10),
        Map.entry("matches", 10),
        Map.entry("correlationMatches", 12),
        // 聚合与分析
        Map.entry("enrichment", 15),
        Map.entry("sightings", 15),
        Map.entry("attribution", 20),
        Map.entry("analytics", 25),
        Map.entry("dashboard", 30)
    );

    /** 路径中出现即视为昂贵分析查询 */
    private static final List<String> EXPENSIVE_PATTERNS = List.of("analytics", "dashboard", "enrichment");

    /** 根参数名 -> 实体类型，用于预取 */
    public static final Map<String, String> ROOT_ID_ARGUMENTS = Map.of(
        "threatId", "threat",
        "iocId", "ioc",
        "actorId", "actor",
        "campaignId", "campaign"
    );

    public static boolean isRelationship(String field) {
        return RELATIONSHIP_TARGETS.containsKey(field);
    }

    public static boolean isBatchable(String field) {
        return BATCH_BENEFITS.containsKey(field);
    }

    public static Optional<String> targetType(String field) {
        return Optional.ofNullable(RELATIONSHIP_TARGETS.get(field));
    }

    public static double batchBenefit(String field) {
        return BATCH_BENEFITS.getOrDefault(field, DEFAULT_BATCH_BENEFIT);
    }

    public static int weight(String field) {
        return WEIGHTS.getOrDefault(field, DEFAULT_WEIGHT);
    }

    public static boolean isExpensivePath(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        for (String pattern : EXPENSIVE_PATTERNS) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
