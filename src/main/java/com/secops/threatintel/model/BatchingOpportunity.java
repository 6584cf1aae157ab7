package com.secops.threatintel.model;

/**
 * @param field            字段名
 * @param path             完整点分路径
 * @param estimatedBenefit 批量获取相对逐条获取的收益估计，取值 [0,1]
 */
public record BatchingOpportunity(String field, String path, double estimatedBenefit) {
}
