package com.secops.threatintel.service;

import com.alibaba.fastjson2.JSON;
import com.secops.threatintel.config.ThreatIntelProperties;
import org.apache.rocketmq.spring.core.RocketMQTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Service;

/**
 * 通过 RocketMQ 广播本地缓存失效
 */
@Service
@ConditionalOnProperty(prefix = "threatintel.cache.broadcast", name = "enabled", havingValue = "true")
public class RocketMQInvalidationBroadcaster implements CacheInvalidationBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(RocketMQInvalidationBroadcaster.class);

    private final RocketMQTemplate rocketMQTemplate;
    private final InstanceIdentity instanceIdentity;
    private final String topic;

    public RocketMQInvalidationBroadcaster(RocketMQTemplate rocketMQTemplate,
                                           InstanceIdentity instanceIdentity,
                                           ThreatIntelProperties properties) {
        this.rocketMQTemplate = rocketMQTemplate;
        this.instanceIdentity = instanceIdentity;
        this.topic = properties.getCache().getBroadcast().getTopic();
    }

    @Override
    public void broadcastLocalInvalidate(String pattern) {
        LocalInvalidateMessage message = new LocalInvalidateMessage(
            pattern, instanceIdentity.id(), System.currentTimeMillis());
        try {
            rocketMQTemplate.syncSend(topic, MessageBuilder.withPayload(JSON.toJSONString(message)).build());
            log.debug("Local invalidate broadcast sent: pattern={}", pattern);
        } catch (Exception e) {
            log.error("Failed to send local invalidate broadcast: pattern={}", pattern, e);
        }
    }

    /**
     * 本地缓存失效消息
     */
    public record LocalInvalidateMessage(String pattern, String sourceInstance, long timestamp) {}
}
