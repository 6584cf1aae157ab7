package com.secops.threatintel.security;

/**
 * 调用方身份上下文
 *
 * @param organizationId 所属组织
 * @param userId         用户 ID
 * @param role           角色，无法识别时为 null
 */
public record IdentityContext(String organizationId, String userId, Role role) {

    public boolean isComplete() {
        return organizationId != null && !organizationId.isBlank()
            && userId != null && !userId.isBlank();
    }

    /**
     * 角色等级，未知角色为 -1
     */
    public int roleRank() {
        return role == null ? -1 : role.rank();
    }
}
