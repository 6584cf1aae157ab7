package com.secops.threatintel.exception;

/**
 * 角色或组织不匹配
 */
public class ForbiddenException extends ThreatIntelException {

    public ForbiddenException(String message) {
        super(message);
    }
}
