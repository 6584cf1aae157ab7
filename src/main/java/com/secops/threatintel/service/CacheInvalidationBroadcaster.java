package com.secops.threatintel.service;

/**
 * 本地缓存失效广播，多实例部署时同步各实例的 LOCAL 层
 */
public interface CacheInvalidationBroadcaster {

    void broadcastLocalInvalidate(String pattern);
}
