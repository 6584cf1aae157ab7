package com.secops.threatintel.subscription.transport;

import com.alibaba.fastjson2.JSON;
import com.secops.threatintel.exception.EventPublishException;
import com.secops.threatintel.subscription.DomainEvent;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Redis Pub/Sub 传输
 * 事件以 JSON 发布到 "{channelPrefix}{topic}" 频道，多实例共享
 */
public class RedisPubSubTransport implements PubSubTransport {

    private static final Logger log = LoggerFactory.getLogger(RedisPubSubTransport.class);

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer container;
    private final String channelPrefix;
    private final Map<String, MessageListener> listeners = new ConcurrentHashMap<>();
    private volatile boolean running = true;

    public RedisPubSubTransport(StringRedisTemplate redisTemplate,
                                RedisMessageListenerContainer container,
                                String channelPrefix) {
        this.redisTemplate = redisTemplate;
        this.container = container;
        this.channelPrefix = channelPrefix;
    }

    @Override
    public void publish(String topic, DomainEvent event) {
        if (!running) {
            throw new EventPublishException("Transport is shut down", null);
        }
        try {
            redisTemplate.convertAndSend(channel(topic), JSON.toJSONString(event));
        } catch (Exception e) {
            log.error("Redis publish failed: topic={}, eventId={}", topic, event.getEventId(), e);
            throw new EventPublishException("Failed to publish event to " + topic, e);
        }
    }

    @Override
    public void subscribe(String topic, Consumer<DomainEvent> listener) {
        MessageListener messageListener = (message, pattern) -> {
            try {
                String body = new String(message.getBody(), StandardCharsets.UTF_8);
                listener.accept(JSON.parseObject(body, DomainEvent.class));
            } catch (Exception e) {
                log.error("Redis event handling failed: topic={}", topic, e);
            }
        };
        MessageListener previous = listeners.put(topic, messageListener);
        if (previous != null) {
            container.removeMessageListener(previous, new ChannelTopic(channel(topic)));
        }
        container.addMessageListener(messageListener, new ChannelTopic(channel(topic)));
        log.debug("Redis channel subscribed: {}", channel(topic));
    }

    @Override
    public void unsubscribe(String topic) {
        MessageListener listener = listeners.remove(topic);
        if (listener != null) {
            container.removeMessageListener(listener, new ChannelTopic(channel(topic)));
            log.debug("Redis channel unsubscribed: {}", channel(topic));
        }
    }

    @Override
    public boolean isHealthy() {
        return running && container.isRunning();
    }

    @Override
    public String name() {
        return "redis";
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        listeners.forEach((topic, listener) ->
            container.removeMessageListener(listener, new ChannelTopic(channel(topic))));
        listeners.clear();
        log.info("Redis transport shut down");
    }

    private String channel(String topic) {
        return channelPrefix + topic;
    }
}
