package com.secops.threatintel.consumer;

import com.alibaba.fastjson2.JSON;
import com.secops.threatintel.service.InstanceIdentity;
import com.secops.threatintel.service.RocketMQInvalidationBroadcaster.LocalInvalidateMessage;
import com.secops.threatintel.service.TieredResultCache;
import org.apache.rocketmq.spring.annotation.MessageModel;
import org.apache.rocketmq.spring.annotation.RocketMQMessageListener;
import org.apache.rocketmq.spring.core.RocketMQListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 本地缓存广播消费者
 * 广播模式，所有实例都会收到；只失效 LOCAL 层
 */
@Component
@ConditionalOnProperty(prefix = "threatintel.cache.broadcast", name = "enabled", havingValue = "true")
@RocketMQMessageListener(
    topic = "${threatintel.cache.broadcast.topic:TI_LOCAL_CACHE_INVALIDATE_TOPIC}",
    consumerGroup = "${spring.application.name:threat-intel-access}_LOCAL_CACHE",
    messageModel = MessageModel.BROADCASTING
)
public class LocalCacheBroadcastConsumer implements RocketMQListener<String> {

    private static final Logger log = LoggerFactory.getLogger(LocalCacheBroadcastConsumer.class);

    private final TieredResultCache tieredResultCache;
    private final InstanceIdentity instanceIdentity;

    public LocalCacheBroadcastConsumer(TieredResultCache tieredResultCache, InstanceIdentity instanceIdentity) {
        this.tieredResultCache = tieredResultCache;
        this.instanceIdentity = instanceIdentity;
    }

    @Override
    public void onMessage(String message) {
        try {
            LocalInvalidateMessage msg = JSON.parseObject(message, LocalInvalidateMessage.class);

            // 跳过自己发送的消息
            if (instanceIdentity.id().equals(msg.sourceInstance())) {
                log.debug("Skipping self-sent message");
                return;
            }

            int removed = tieredResultCache.invalidateLocalPattern(msg.pattern());
            log.info("Local cache broadcast invalidated: pattern={}, removed={}, source={}",
                msg.pattern(), removed, msg.sourceInstance());
        } catch (Exception e) {
            log.error("Local cache broadcast invalidate failed", e);
        }
    }
}
