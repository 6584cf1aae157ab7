package com.secops.threatintel.subscription;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 发布到组织主题上的领域事件
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DomainEvent {

    private String eventId;
    private String organizationId;

    /** 不含组织后缀的主题，如 IOC_MATCH */
    private String baseTopic;

    /** baseTopic:organizationId */
    private String topic;

    private Map<String, Object> payload;
    private long timestamp;
}
