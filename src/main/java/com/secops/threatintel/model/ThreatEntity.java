package com.secops.threatintel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 存储适配器返回的实体
 * 关系字段在 attributes 中以 ID 列表保存
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreatEntity {

    private String type;
    private String id;
    private String organizationId;

    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    public Object attribute(String name) {
        return attributes == null ? null : attributes.get(name);
    }
}
