package com.secops.threatintel.exception;

/**
 * 订阅过滤条件或请求参数非法
 */
public class ValidationException extends ThreatIntelException {

    public ValidationException(String message) {
        super(message);
    }
}
