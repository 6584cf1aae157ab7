package com.secops.threatintel.subscription;

import com.secops.threatintel.exception.ValidationException;
import com.secops.threatintel.security.AccessPolicy;
import com.secops.threatintel.security.IdentityContext;
import com.secops.threatintel.security.Role;
import org.springframework.stereotype.Component;

/**
 * 主题路由
 * 主题名为 "baseTopic:organizationId"，订阅时校验角色和组织
 */
@Component
public class TopicRouter {

    static final String SEPARATOR = ":";

    private final AccessPolicy accessPolicy;

    public TopicRouter(AccessPolicy accessPolicy) {
        this.accessPolicy = accessPolicy;
    }

    public String topicFor(String baseTopic, String organizationId) {
        if (baseTopic == null || baseTopic.isBlank() || baseTopic.contains(SEPARATOR)) {
            throw new ValidationException("Invalid base topic: " + baseTopic);
        }
        if (organizationId == null || organizationId.isBlank()) {
            throw new ValidationException("organizationId is required");
        }
        return baseTopic + SEPARATOR + organizationId;
    }

    public IdentityContext authorize(IdentityContext context, Role requiredRole) {
        return accessPolicy.authorize(context, requiredRole);
    }

    public Role requiredRoleFor(String baseTopic) {
        return ThreatTopic.of(baseTopic)
            .map(ThreatTopic::requiredRole)
            .orElse(ThreatTopic.DEFAULT_REQUIRED_ROLE);
    }

    /**
     * 订阅鉴权，返回完整主题名
     * organizationId 为空时使用调用方所属组织；跨组织仅 SUPER_ADMIN 可访问
     */
    public String authorizeSubscription(IdentityContext context, String baseTopic, String organizationId) {
        authorize(context, requiredRoleFor(baseTopic));
        String target = organizationId == null || organizationId.isBlank()
            ? context.organizationId() : organizationId;
        accessPolicy.checkOrganization(context, target);
        return topicFor(baseTopic, target);
    }
}
