package com.secops.threatintel.model;

/**
 * 读请求执行策略
 */
public enum ExecutionStrategy {
    /** 复杂度高，预取并使用最长缓存 */
    AGGRESSIVE_CACHING,
    /** 批量机会多，调大批次 */
    BATCHING_FOCUSED,
    /** 关系字段多，并行解析并预注册加载器 */
    DATALOADER_INTENSIVE,
    STANDARD
}
