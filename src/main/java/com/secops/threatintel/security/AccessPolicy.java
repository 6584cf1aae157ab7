package com.secops.threatintel.security;

import com.secops.threatintel.exception.AuthenticationException;
import com.secops.threatintel.exception.ForbiddenException;
import org.springframework.stereotype.Component;

/**
 * 身份与组织访问校验
 * 读路径和订阅路径共用同一套角色等级规则
 */
@Component
public class AccessPolicy {

    /**
     * 校验身份存在且角色不低于 requiredRole
     */
    public IdentityContext authorize(IdentityContext context, Role requiredRole) {
        if (context == null || !context.isComplete()) {
            throw new AuthenticationException("Authentication required");
        }
        if (context.roleRank() < requiredRole.rank()) {
            throw new ForbiddenException("Role " + requiredRole + " or higher required");
        }
        return context;
    }

    /**
     * 跨组织访问仅允许 SUPER_ADMIN
     */
    public void checkOrganization(IdentityContext context, String organizationId) {
        if (organizationId == null || organizationId.equals(context.organizationId())) {
            return;
        }
        if (context.role() != Role.SUPER_ADMIN) {
            throw new ForbiddenException("Access to organization " + organizationId + " denied");
        }
    }
}
