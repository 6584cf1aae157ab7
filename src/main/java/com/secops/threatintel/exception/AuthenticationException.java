package com.secops.threatintel.exception;

/**
 * 身份上下文缺失，直接返回调用方，不重试
 */
public class AuthenticationException extends ThreatIntelException {

    public AuthenticationException(String message) {
        super(message);
    }
}
