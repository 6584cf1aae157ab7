package com.secops.threatintel.subscription.transport;

import com.secops.threatintel.subscription.DomainEvent;

import java.util.function.Consumer;

/**
 * 发布订阅传输层
 * 由 Spring 显式创建并管理生命周期，关闭时停止接收并排空
 */
public interface PubSubTransport {

    /**
     * 异步发布，不等待订阅方处理
     */
    void publish(String topic, DomainEvent event);

    /**
     * 每个主题只注册一个监听器，重复注册会替换
     */
    void subscribe(String topic, Consumer<DomainEvent> listener);

    void unsubscribe(String topic);

    boolean isHealthy();

    String name();
}
