package com.secops.threatintel.security;

import java.util.Locale;
import java.util.Optional;

/**
 * 角色等级，按声明顺序由低到高
 */
public enum Role {
    VIEWER,
    ANALYST,
    INCIDENT_RESPONDER,
    ADMIN,
    SUPER_ADMIN;

    public int rank() {
        return ordinal();
    }

    public boolean atLeast(Role required) {
        return rank() >= required.rank();
    }

    /**
     * 解析请求头中的角色，未知角色返回 empty
     */
    public static Optional<Role> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Role.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
