package com.secops.threatintel.subscription;

import com.secops.threatintel.exception.ValidationException;
import com.secops.threatintel.subscription.transport.PubSubTransport;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 领域事件发布
 * 写路径调用；解析主题后交给传输层，不等待订阅方处理
 */
@Slf4j
@Service
public class ThreatEventPublisher {

    public static final String PRIORITY_MEDIUM = "MEDIUM";
    public static final double DEFAULT_SIGNIFICANCE = 0.5;

    private final TopicRouter topicRouter;
    private final PubSubTransport transport;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public ThreatEventPublisher(TopicRouter topicRouter, PubSubTransport transport,
                                Clock clock, MeterRegistry meterRegistry) {
        this.topicRouter = topicRouter;
        this.transport = transport;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public DomainEvent publish(String organizationId, String baseTopic, Map<String, Object> payload) {
        String topic = topicRouter.topicFor(baseTopic, organizationId);
        if (payload == null) {
            throw new ValidationException("payload is required");
        }
        DomainEvent event = DomainEvent.builder()
            .eventId(UUID.randomUUID().toString())
            .organizationId(organizationId)
            .baseTopic(baseTopic)
            .topic(topic)
            .payload(payload)
            .timestamp(clock.millis())
            .build();
        transport.publish(topic, event);
        meterRegistry.counter("threatintel.events.published", "topic", baseTopic).increment();
        log.debug("Event published: eventId={}, topic={}", event.getEventId(), topic);
        return event;
    }

    // ==================== 类型化发布 ====================

    public DomainEvent publishThreatIntelligenceUpdate(String organizationId, String updateType,
                                                       Map<String, Object> threat,
                                                       Map<String, Object> previousValues,
                                                       List<String> changedFields, String source) {
        return publish(organizationId, ThreatTopic.THREAT_INTELLIGENCE_UPDATE.name(), payload(
            "type", updateType,
            "threat", threat,
            "previousValues", previousValues,
            "changedFields", changedFields,
            "source", source));
    }

    public DomainEvent publishIocMatch(String organizationId, Map<String, Object> ioc, Map<String, Object> match,
                                       Map<String, Object> alert, Map<String, Object> asset) {
        return publishIocMatch(organizationId, ioc, match, alert, asset, PRIORITY_MEDIUM);
    }

    public DomainEvent publishIocMatch(String organizationId, Map<String, Object> ioc, Map<String, Object> match,
                                       Map<String, Object> alert, Map<String, Object> asset, String priority) {
        return publish(organizationId, ThreatTopic.IOC_MATCH.name(), payload(
            "ioc", ioc,
            "match", match,
            "alert", alert,
            "asset", asset,
            "priority", priority));
    }

    public DomainEvent publishNewIoc(String organizationId, Map<String, Object> ioc, String source,
                                     String priority, List<String> matchingFilters) {
        return publish(organizationId, ThreatTopic.NEW_IOC.name(), payload(
            "ioc", ioc,
            "source", source,
            "priority", priority,
            "matchingFilters", matchingFilters));
    }

    public DomainEvent publishThreatFeedUpdate(String organizationId, String updateType, Map<String, Object> feed,
                                               Map<String, Object> stats, String message) {
        return publish(organizationId, ThreatTopic.THREAT_FEED_UPDATE.name(), payload(
            "type", updateType,
            "feed", feed,
            "stats", stats,
            "message", message));
    }

    public DomainEvent publishCorrelationMatch(String organizationId, Map<String, Object> correlation,
                                               Map<String, Object> match, double confidence, String priority,
                                               List<String> affectedAssets) {
        return publish(organizationId, ThreatTopic.CORRELATION_MATCH.name(), payload(
            "correlation", correlation,
            "match", match,
            "confidence", confidence,
            "priority", priority,
            "affectedAssets", affectedAssets));
    }

    public DomainEvent publishAttributionUpdate(String organizationId, String updateType,
                                                Map<String, Object> threat, Map<String, Object> attribution,
                                                double confidence, List<Map<String, Object>> evidence) {
        return publish(organizationId, ThreatTopic.ATTRIBUTION_UPDATE.name(), payload(
            "type", updateType,
            "threat", threat,
            "attribution", attribution,
            "confidence", confidence,
            "evidence", evidence));
    }

    public DomainEvent publishThreatActorActivity(String organizationId, String activityType,
                                                  Map<String, Object> actor, Map<String, Object> activity) {
        return publishThreatActorActivity(organizationId, activityType, actor, activity, DEFAULT_SIGNIFICANCE);
    }

    public DomainEvent publishThreatActorActivity(String organizationId, String activityType,
                                                  Map<String, Object> actor, Map<String, Object> activity,
                                                  double significance) {
        return publish(organizationId, ThreatTopic.THREAT_ACTOR_ACTIVITY.name(), payload(
            "type", activityType,
            "actor", actor,
            "activity", activity,
            "significance", significance));
    }

    public DomainEvent publishCampaignUpdate(String organizationId, String updateType,
                                             Map<String, Object> campaign, Map<String, Object> changes,
                                             Map<String, Object> impact) {
        return publish(organizationId, ThreatTopic.THREAT_CAMPAIGN_UPDATE.name(), payload(
            "type", updateType,
            "campaign", campaign,
            "changes", changes,
            "impact", impact));
    }

    public DomainEvent publishThreatLandscapeUpdate(String organizationId, String updateType,
                                                    Map<String, Object> changes, List<String> affectedSectors,
                                                    List<String> affectedRegions, double significance) {
        return publish(organizationId, ThreatTopic.THREAT_LANDSCAPE_UPDATE.name(), payload(
            "type", updateType,
            "changes", changes,
            "affectedSectors", affectedSectors,
            "affectedRegions", affectedRegions,
            "significance", significance));
    }

    /**
     * 键值对组装 payload，忽略 null 值
     */
    static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                payload.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return payload;
    }
}
