package com.secops.threatintel.subscription.transport;

import com.secops.threatintel.exception.EventPublishException;
import com.secops.threatintel.subscription.DomainEvent;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 进程内传输，单实例部署和测试使用
 */
public class InMemoryPubSubTransport implements PubSubTransport {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPubSubTransport.class);

    private final Executor executor;
    private final Map<String, Consumer<DomainEvent>> listeners = new ConcurrentHashMap<>();
    private volatile boolean running = true;

    public InMemoryPubSubTransport(Executor executor) {
        this.executor = executor;
    }

    @Override
    public void publish(String topic, DomainEvent event) {
        if (!running) {
            throw new EventPublishException("Transport is shut down", null);
        }
        Consumer<DomainEvent> listener = listeners.get(topic);
        if (listener == null) {
            log.debug("No listener for topic: {}", topic);
            return;
        }
        try {
            executor.execute(() -> {
                try {
                    listener.accept(event);
                } catch (Exception e) {
                    log.error("Listener failed: topic={}, eventId={}", topic, event.getEventId(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new EventPublishException("Transport rejected event for topic " + topic, e);
        }
    }

    @Override
    public void subscribe(String topic, Consumer<DomainEvent> listener) {
        listeners.put(topic, listener);
    }

    @Override
    public void unsubscribe(String topic) {
        listeners.remove(topic);
    }

    @Override
    public boolean isHealthy() {
        return running;
    }

    @Override
    public String name() {
        return "in-memory";
    }

    /**
     * 停止接收并等待已提交事件处理完
     */
    @PreDestroy
    public void shutdown() {
        running = false;
        if (executor instanceof ExecutorService service) {
            service.shutdown();
            try {
                if (!service.awaitTermination(5, TimeUnit.SECONDS)) {
                    service.shutdownNow();
                }
            } catch (InterruptedException e) {
                service.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        listeners.clear();
        log.info("In-memory transport shut down");
    }
}
