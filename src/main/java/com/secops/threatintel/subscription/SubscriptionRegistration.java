package com.secops.threatintel.subscription;

import lombok.Getter;

/**
 * 订阅登记，只属于一个组织，topic 以该组织 ID 结尾
 */
@Getter
public class SubscriptionRegistration {

    private final String connectionId;
    private final String organizationId;
    private final String baseTopic;
    private final String topic;
    private final FilterExpression filter;
    private final EventSink sink;
    private volatile long lastHeartbeat;

    public SubscriptionRegistration(String connectionId, String organizationId, String baseTopic,
                                    String topic, FilterExpression filter, EventSink sink, long now) {
        this.connectionId = connectionId;
        this.organizationId = organizationId;
        this.baseTopic = baseTopic;
        this.topic = topic;
        this.filter = filter;
        this.sink = sink;
        this.lastHeartbeat = now;
    }

    public void touch(long now) {
        this.lastHeartbeat = now;
    }

    public boolean isStale(long now, long maxAgeMillis) {
        return now - lastHeartbeat > maxAgeMillis;
    }
}
