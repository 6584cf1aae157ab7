package com.secops.threatintel.model;

/**
 * 字段级错误，与部分结果一起返回
 */
public record FieldError(String path, String message) {
}
