package com.secops.threatintel.subscription;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 订阅健康监控
 * 按 (topic, organizationId) 维护引用计数与最近心跳；清理的是路由元数据，连接断开由传输层负责
 */
@Slf4j
@Component
public class SubscriptionHealthMonitor {

    public static final long DEFAULT_MAX_AGE_MS = 300_000L;

    private final Clock clock;
    private final Map<TopicKey, TopicHealth> topics = new ConcurrentHashMap<>();

    public SubscriptionHealthMonitor(Clock clock) {
        this.clock = clock;
    }

    public void trackSubscription(String topic, String organizationId) {
        long now = clock.millis();
        topics.merge(new TopicKey(topic, organizationId), new TopicHealth(1, now),
            (current, added) -> new TopicHealth(current.count() + 1, now));
    }

    public void untrackSubscription(String topic, String organizationId) {
        topics.computeIfPresent(new TopicKey(topic, organizationId), (key, current) ->
            current.count() <= 1 ? null : new TopicHealth(current.count() - 1, current.lastHeartbeat()));
    }

    /**
     * 刷新心跳，未跟踪的主题忽略
     */
    public void heartbeat(String topic, String organizationId) {
        long now = clock.millis();
        topics.computeIfPresent(new TopicKey(topic, organizationId),
            (key, current) -> new TopicHealth(current.count(), now));
    }

    public int cleanupStaleSubscriptions() {
        return cleanupStaleSubscriptions(DEFAULT_MAX_AGE_MS);
    }

    /**
     * 删除心跳早于 maxAgeMs 的主题，返回删除的订阅数
     */
    public int cleanupStaleSubscriptions(long maxAgeMs) {
        long cutoff = clock.millis() - maxAgeMs;
        int removed = 0;
        for (Map.Entry<TopicKey, TopicHealth> entry : topics.entrySet()) {
            TopicHealth health = entry.getValue();
            if (health.lastHeartbeat() < cutoff && topics.remove(entry.getKey(), health)) {
                removed += health.count();
                log.info("Stale subscription metadata removed: topic={}, org={}, count={}",
                    entry.getKey().topic(), entry.getKey().organizationId(), health.count());
            }
        }
        return removed;
    }

    public SubscriptionStats getSubscriptionStats() {
        Map<String, Integer> byTopic = new TreeMap<>();
        int total = 0;
        for (Map.Entry<TopicKey, TopicHealth> entry : topics.entrySet()) {
            byTopic.merge(entry.getKey().topic(), entry.getValue().count(), Integer::sum);
            total += entry.getValue().count();
        }
        return new SubscriptionStats(total, byTopic, byTopic.size());
    }

    public record SubscriptionStats(int totalSubscriptions, Map<String, Integer> subscriptionsByTopic,
                                    int activeTopics) {}

    private record TopicKey(String topic, String organizationId) {}

    private record TopicHealth(int count, long lastHeartbeat) {}
}
