package com.secops.threatintel.dto;

import com.secops.threatintel.subscription.FilterExpression;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 订阅请求；organizationId 为空时使用调用方所属组织
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscribeRequest {

    private String baseTopic;
    private String organizationId;
    private FilterExpression filter;
}
