package com.secops.threatintel.security;

import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * 从请求头解析调用方身份
 * 缺少组织或用户时返回 null，由业务层按未认证处理；无法识别的角色视为无角色
 */
public class IdentityContextArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String ORGANIZATION_HEADER = "X-Organization-Id";
    public static final String USER_HEADER = "X-User-Id";
    public static final String ROLE_HEADER = "X-User-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return IdentityContext.class.equals(parameter.getParameterType());
    }

    @Override
    public IdentityContext resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                           NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        String organizationId = webRequest.getHeader(ORGANIZATION_HEADER);
        String userId = webRequest.getHeader(USER_HEADER);
        if (isBlank(organizationId) || isBlank(userId)) {
            return null;
        }
        Role role = Role.parse(webRequest.getHeader(ROLE_HEADER)).orElse(null);
        return new IdentityContext(organizationId.trim(), userId.trim(), role);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
