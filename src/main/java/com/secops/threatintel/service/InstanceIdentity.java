package com.secops.threatintel.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 当前实例标识，用于跳过自己发出的广播
 */
@Component
public class InstanceIdentity {

    private final String id;

    public InstanceIdentity(@Value("${spring.application.name:threat-intel-access}") String applicationName) {
        this.id = applicationName + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public String id() {
        return id;
    }
}
