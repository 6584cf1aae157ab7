package com.secops.threatintel.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 读请求
 * fields 为解码后的字段树：值为对象表示有子选择，其它值表示叶子
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    private String queryName;

    /** 根实体类型，如 threat、ioc */
    private String entityType;

    /** ids / filter / threatId / organizationId 等 */
    @Builder.Default
    private Map<String, Object> rootArguments = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> fields = new LinkedHashMap<>();
}
