package com.secops.threatintel.service;

import com.secops.threatintel.model.ThreatEntity;

import java.util.List;

/**
 * 批量拉取实体，返回结果不要求与 ids 顺序一致，缺失的 ID 直接省略
 */
@FunctionalInterface
public interface EntityFetcher {

    List<ThreatEntity> fetch(String entityType, List<String> ids);
}
