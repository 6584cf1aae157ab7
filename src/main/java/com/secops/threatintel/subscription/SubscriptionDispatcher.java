package com.secops.threatintel.subscription;

import com.secops.threatintel.config.ThreatIntelProperties;
import com.secops.threatintel.constant.CacheConstants;
import com.secops.threatintel.security.IdentityContext;
import com.secops.threatintel.subscription.transport.PubSubTransport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 订阅分发
 * <p>
 * 订阅时鉴权并校验过滤条件；收到事件后先按 (组织, 主题) 限流，
 * 再为每个订阅提交独立的投递任务，一个订阅被过滤或投递失败不影响其它订阅。
 */
@Service
public class SubscriptionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionDispatcher.class);

    private final TopicRouter topicRouter;
    private final FilterEvaluator filterEvaluator;
    private final SubscriptionRateLimiter rateLimiter;
    private final SubscriptionHealthMonitor healthMonitor;
    private final PubSubTransport transport;
    private final Executor deliveryExecutor;
    private final Clock clock;
    private final ThreatIntelProperties.SubscriptionConfig config;

    /** connectionId -> 订阅 */
    private final Map<String, SubscriptionRegistration> registrations = new ConcurrentHashMap<>();
    /** topic -> connectionId 集合 */
    private final Map<String, Set<String>> connectionsByTopic = new ConcurrentHashMap<>();

    private final Counter deliveredCounter;
    private final Counter filteredCounter;
    private final Counter rateLimitedCounter;
    private final Counter failureCounter;

    public SubscriptionDispatcher(TopicRouter topicRouter,
                                  FilterEvaluator filterEvaluator,
                                  SubscriptionRateLimiter rateLimiter,
                                  SubscriptionHealthMonitor healthMonitor,
                                  PubSubTransport transport,
                                  @Qualifier("deliveryExecutor") Executor deliveryExecutor,
                                  Clock clock,
                                  ThreatIntelProperties properties,
                                  MeterRegistry meterRegistry) {
        this.topicRouter = topicRouter;
        this.filterEvaluator = filterEvaluator;
        this.rateLimiter = rateLimiter;
        this.healthMonitor = healthMonitor;
        this.transport = transport;
        this.deliveryExecutor = deliveryExecutor;
        this.clock = clock;
        this.config = properties.getSubscription();

        this.deliveredCounter = eventCounter(meterRegistry, "delivered");
        this.filteredCounter = eventCounter(meterRegistry, "filtered");
        this.rateLimitedCounter = eventCounter(meterRegistry, "rate_limited");
        this.failureCounter = eventCounter(meterRegistry, "failed");
        Gauge.builder("threatintel.subscription.active", registrations, Map::size)
            .description("Active subscription registrations")
            .register(meterRegistry);
    }

    /**
     * 订阅；鉴权或过滤条件校验失败时不创建任何登记
     */
    public SubscriptionHandle subscribe(IdentityContext identity, String baseTopic, String organizationId,
                                        FilterExpression filter, EventSink sink) {
        String topic = topicRouter.authorizeSubscription(identity, baseTopic, organizationId);
        filterEvaluator.validate(filter);

        String targetOrganization = topic.substring(baseTopic.length() + TopicRouter.SEPARATOR.length());
        String connectionId = UUID.randomUUID().toString();
        SubscriptionRegistration registration = new SubscriptionRegistration(
            connectionId, targetOrganization, baseTopic, topic, filter, sink, clock.millis());

        registrations.put(connectionId, registration);
        connectionsByTopic.compute(topic, (key, connections) -> {
            Set<String> updated = connections == null ? ConcurrentHashMap.newKeySet() : connections;
            if (updated.isEmpty()) {
                transport.subscribe(topic, this::onMessage);
            }
            updated.add(connectionId);
            return updated;
        });
        healthMonitor.trackSubscription(topic, targetOrganization);

        log.info("Subscription created: connectionId={}, topic={}, user={}, filtered={}",
            connectionId, topic, identity.userId(), filter != null);
        return new SubscriptionHandle(connectionId, targetOrganization, topic);
    }

    public boolean unsubscribe(String connectionId) {
        SubscriptionRegistration registration = registrations.remove(connectionId);
        if (registration == null) {
            return false;
        }
        String topic = registration.getTopic();
        connectionsByTopic.computeIfPresent(topic, (key, connections) -> {
            connections.remove(connectionId);
            if (connections.isEmpty()) {
                transport.unsubscribe(topic);
                return null;
            }
            return connections;
        });
        healthMonitor.untrackSubscription(topic, registration.getOrganizationId());
        closeQuietly(registration);
        log.info("Subscription removed: connectionId={}, topic={}", connectionId, topic);
        return true;
    }

    /**
     * 客户端心跳
     */
    public boolean ping(String connectionId) {
        SubscriptionRegistration registration = registrations.get(connectionId);
        if (registration == null) {
            return false;
        }
        registration.touch(clock.millis());
        healthMonitor.heartbeat(registration.getTopic(), registration.getOrganizationId());
        return true;
    }

    /**
     * 传输层回调
     */
    public void onMessage(DomainEvent event) {
        Set<String> connections = connectionsByTopic.get(event.getTopic());
        if (connections == null || connections.isEmpty()) {
            return;
        }
        if (!rateLimiter.checkLimit(event.getOrganizationId(), event.getBaseTopic(), config.getMaxEventsPerMinute())) {
            rateLimitedCounter.increment();
            return;
        }
        for (String connectionId : connections) {
            SubscriptionRegistration registration = registrations.get(connectionId);
            if (registration == null) {
                continue;
            }
            try {
                deliveryExecutor.execute(() -> deliver(registration, event));
            } catch (RejectedExecutionException e) {
                failureCounter.increment();
                log.warn("Delivery rejected: connectionId={}, eventId={}", connectionId, event.getEventId());
            }
        }
    }

    private void deliver(SubscriptionRegistration registration, DomainEvent event) {
        boolean matched;
        try {
            matched = filterEvaluator.matches(registration.getFilter(), event.getPayload());
        } catch (RuntimeException e) {
            failureCounter.increment();
            log.warn("Filter evaluation failed, event skipped: connectionId={}, eventId={}, error={}",
                registration.getConnectionId(), event.getEventId(), e.toString());
            return;
        }
        if (!matched) {
            filteredCounter.increment();
            return;
        }
        try {
            registration.getSink().send(event);
            registration.touch(clock.millis());
            healthMonitor.heartbeat(registration.getTopic(), registration.getOrganizationId());
            deliveredCounter.increment();
        } catch (Exception e) {
            failureCounter.increment();
            log.warn("Delivery failed, removing subscription: connectionId={}, topic={}, error={}",
                registration.getConnectionId(), registration.getTopic(), e.toString());
            unsubscribe(registration.getConnectionId());
        }
    }

    /**
     * 移除心跳超时的订阅并关闭其出口，返回移除数量
     */
    public int evictStale(long maxAgeMillis) {
        long now = clock.millis();
        List<String> stale = new ArrayList<>();
        registrations.forEach((connectionId, registration) -> {
            if (registration.isStale(now, maxAgeMillis)) {
                stale.add(connectionId);
            }
        });
        int evicted = 0;
        for (String connectionId : stale) {
            if (unsubscribe(connectionId)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Stale subscriptions evicted: {}", evicted);
        }
        return evicted;
    }

    public Optional<SubscriptionRegistration> registration(String connectionId) {
        return Optional.ofNullable(registrations.get(connectionId));
    }

    public int activeRegistrations() {
        return registrations.size();
    }

    public DispatchStats stats() {
        return new DispatchStats(registrations.size(), (long) deliveredCounter.count(),
            (long) filteredCounter.count(), (long) rateLimitedCounter.count(), (long) failureCounter.count());
    }

    @PreDestroy
    public void shutdown() {
        for (String connectionId : List.copyOf(registrations.keySet())) {
            unsubscribe(connectionId);
        }
        log.info("Subscription dispatcher shut down");
    }

    private void closeQuietly(SubscriptionRegistration registration) {
        try {
            registration.getSink().close();
        } catch (Exception e) {
            log.debug("Sink close failed: connectionId={}, error={}", registration.getConnectionId(), e.toString());
        }
    }

    private static Counter eventCounter(MeterRegistry registry, String outcome) {
        return Counter.builder(CacheConstants.METRIC_SUBSCRIPTION_EVENTS)
            .tag("outcome", outcome)
            .register(registry);
    }

    public record DispatchStats(int activeRegistrations, long delivered, long filteredOut,
                                long rateLimited, long deliveryFailures) {}
}
