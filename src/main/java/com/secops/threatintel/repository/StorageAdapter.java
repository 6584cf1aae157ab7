package com.secops.threatintel.repository;

import com.secops.threatintel.model.ThreatEntity;

import java.util.List;
import java.util.Map;

/**
 * 存储适配器，由持久层实现
 * 核心只通过该接口按 ID 或过滤条件取数，不直接发起查询
 */
public interface StorageAdapter {

    /**
     * 按 ID 批量获取，不存在的 ID 直接省略
     */
    List<ThreatEntity> fetchByIds(String entityType, List<String> ids);

    /**
     * 按过滤条件获取；过滤条件中始终包含 organizationId
     */
    List<ThreatEntity> fetchByFilter(String entityType, Map<String, Object> filter);
}
