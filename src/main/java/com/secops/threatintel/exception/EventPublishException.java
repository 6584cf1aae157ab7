package com.secops.threatintel.exception;

public class EventPublishException extends ThreatIntelException {

    public EventPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
