package com.secops.threatintel.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 手动失效请求：给出 entityType + id 失效单个实体，或给出组织内相对模式
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvalidateRequest {

    private String organizationId;
    private String entityType;
    private String id;
    /** 例如 "query:*" */
    private String pattern;
}
