package com.secops.threatintel.constant;

/**
 * 缓存相关常量
 */
public final class CacheConstants {

    private CacheConstants() {}

    // ==================== Key 片段 ====================

    /** 实体缓存段：{prefix}:{org}:entity:{type}:{id} */
    public static final String ENTITY_SEGMENT = "entity";

    /** 查询结果缓存段：{prefix}:{org}:query:{name}:{hash} */
    public static final String QUERY_SEGMENT = "query";

    public static final String KEY_SEPARATOR = ":";

    // ==================== 弹性保护 ====================

    /** SHARED 层熔断器名称 */
    public static final String SHARED_CIRCUIT_BREAKER = "shared-cache";

    // ==================== 指标名 ====================

    public static final String METRIC_CACHE_REQUESTS = "threatintel.cache.requests";
    public static final String METRIC_QUERY_DURATION = "threatintel.query.duration";
    public static final String METRIC_SUBSCRIPTION_EVENTS = "threatintel.subscription.events";
}
