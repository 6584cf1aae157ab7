package com.secops.threatintel.service;

import com.secops.threatintel.model.QueryAnalysis;
import com.secops.threatintel.optimization.RequestCacheConfig;
import com.secops.threatintel.security.IdentityContext;

/**
 * 单个读请求的执行上下文，显式传给每个解析步骤，请求结束即丢弃
 *
 * @param organizationId 本次读取的目标组织，SUPER_ADMIN 跨组织读取时与 identity 中的不同
 */
public record ExecutionContext(
    IdentityContext identity,
    String organizationId,
    String queryId,
    QueryAnalysis analysis,
    RequestCacheConfig cacheConfig,
    BatchingCache batchingCache
) {
}
