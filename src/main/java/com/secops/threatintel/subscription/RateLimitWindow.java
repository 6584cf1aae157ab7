package com.secops.threatintel.subscription;

/**
 * 固定窗口计数，跨入新的分钟时整体替换
 */
public record RateLimitWindow(String organizationId, String topic, long windowStart, int count) {

    public RateLimitWindow increment() {
        return new RateLimitWindow(organizationId, topic, windowStart, count + 1);
    }
}
