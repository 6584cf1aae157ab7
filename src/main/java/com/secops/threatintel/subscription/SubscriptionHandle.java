package com.secops.threatintel.subscription;

public record SubscriptionHandle(String connectionId, String organizationId, String topic) {
}
