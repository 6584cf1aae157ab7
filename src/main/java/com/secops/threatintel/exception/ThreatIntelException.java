package com.secops.threatintel.exception;

/**
 * 数据访问层异常基类
 */
public class ThreatIntelException extends RuntimeException {

    public ThreatIntelException(String message) {
        super(message);
    }

    public ThreatIntelException(String message, Throwable cause) {
        super(message, cause);
    }
}
