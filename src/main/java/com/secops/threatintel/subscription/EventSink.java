package com.secops.threatintel.subscription;

import java.io.IOException;

/**
 * 订阅者的事件出口，如 SSE 连接
 */
public interface EventSink {

    /**
     * 投递失败抛出 IOException，调用方随即注销该订阅
     */
    void send(DomainEvent event) throws IOException;

    default void close() {
    }
}
