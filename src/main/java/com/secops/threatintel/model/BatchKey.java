package com.secops.threatintel.model;

/**
 * 请求内去重单元
 */
public record BatchKey(String entityType, String id) {
}
