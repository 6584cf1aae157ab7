package com.secops.threatintel.subscription;

import com.secops.threatintel.security.Role;

import java.util.Arrays;
import java.util.Optional;

/**
 * 已知主题及订阅所需的最低角色
 */
public enum ThreatTopic {
    THREAT_INTELLIGENCE_UPDATE(Role.ANALYST),
    IOC_MATCH(Role.ANALYST),
    NEW_IOC(Role.ANALYST),
    THREAT_FEED_UPDATE(Role.ADMIN),
    CORRELATION_MATCH(Role.ANALYST),
    ATTRIBUTION_UPDATE(Role.ANALYST),
    THREAT_ACTOR_ACTIVITY(Role.ANALYST),
    THREAT_CAMPAIGN_UPDATE(Role.ANALYST),
    THREAT_LANDSCAPE_UPDATE(Role.ANALYST);

    /** 未登记主题的默认角色 */
    public static final Role DEFAULT_REQUIRED_ROLE = Role.ANALYST;

    private final Role requiredRole;

    ThreatTopic(Role requiredRole) {
        this.requiredRole = requiredRole;
    }

    public Role requiredRole() {
        return requiredRole;
    }

    public static Optional<ThreatTopic> of(String baseTopic) {
        return Arrays.stream(values()).filter(t -> t.name().equals(baseTopic)).findFirst();
    }
}
