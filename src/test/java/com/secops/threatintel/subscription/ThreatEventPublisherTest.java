package com.secops.threatintel.subscription;

import com.secops.threatintel.exception.EventPublishException;
import com.secops.threatintel.exception.ValidationException;
import com.secops.threatintel.security.AccessPolicy;
import com.secops.threatintel.subscription.transport.PubSubTransport;
import com.secops.threatintel.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 事件发布单元测试
 */
@ExtendWith(MockitoExtension.class)
class ThreatEventPublisherTest {

    @Mock
    private PubSubTransport transport;

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private ThreatEventPublisher publisher;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        registry = new SimpleMeterRegistry();
        publisher = new ThreatEventPublisher(new TopicRouter(new AccessPolicy()), transport, clock, registry);
    }

    @Test
    @DisplayName("发布到组织主题")
    void testPublish() {
        DomainEvent event = publisher.publish("org-1", "THREAT_LANDSCAPE_UPDATE", Map.of("k", "v"));

        ArgumentCaptor<DomainEvent> captor = ArgumentCaptor.forClass(DomainEvent.class);
        verify(transport).publish(eq("THREAT_LANDSCAPE_UPDATE:org-1"), captor.capture());
        assertSame(event, captor.getValue());
        assertNotNull(event.getEventId());
        assertEquals("org-1", event.getOrganizationId());
        assertEquals("THREAT_LANDSCAPE_UPDATE", event.getBaseTopic());
        assertEquals(clock.millis(), event.getTimestamp());
        assertEquals(1.0, registry.get("threatintel.events.published").counter().count());
    }

    @Test
    @DisplayName("IOC 匹配默认优先级 MEDIUM，null 字段不写入")
    void testIocMatchDefaults() {
        DomainEvent event = publisher.publishIocMatch("org-1", Map.of("value", "evil.example"),
            Map.of("assetId", "h-1"), null, null);

        assertEquals("IOC_MATCH:org-1", event.getTopic());
        assertEquals("MEDIUM", event.getPayload().get("priority"));
        assertFalse(event.getPayload().containsKey("alert"));
        assertFalse(event.getPayload().containsKey("asset"));
    }

    @Test
    @DisplayName("威胁行为者活动默认显著性 0.5")
    void testActorActivityDefaults() {
        DomainEvent event = publisher.publishThreatActorActivity("org-1", "NEW_INFRASTRUCTURE",
            Map.of("id", "a1"), Map.of("domains", List.of("x.example")));

        assertEquals(0.5, event.getPayload().get("significance"));
        assertEquals("NEW_INFRASTRUCTURE", event.getPayload().get("type"));
    }

    @Test
    @DisplayName("类型化发布使用对应主题")
    void testTypedTopics() {
        assertEquals("THREAT_INTELLIGENCE_UPDATE", publisher.publishThreatIntelligenceUpdate("org-1", "UPDATED",
            Map.of("id", "t1"), Map.of("severity", "LOW"), List.of("severity"), "analyst").getBaseTopic());
        assertEquals("CORRELATION_MATCH", publisher.publishCorrelationMatch("org-1", Map.of("id", "c1"),
            Map.of(), 0.9, "HIGH", List.of("h-1")).getBaseTopic());
        assertEquals("ATTRIBUTION_UPDATE", publisher.publishAttributionUpdate("org-1", "ATTRIBUTED",
            Map.of("id", "t1"), Map.of("actor", "a1"), 0.7, List.of()).getBaseTopic());
        assertEquals("THREAT_CAMPAIGN_UPDATE", publisher.publishCampaignUpdate("org-1", "EXPANDED",
            Map.of("id", "c1"), Map.of(), Map.of()).getBaseTopic());
        verify(transport, times(4)).publish(anyString(), any(DomainEvent.class));
    }

    @Test
    @DisplayName("缺少组织或 payload 时拒绝发布")
    void testValidation() {
        assertThrows(ValidationException.class, () -> publisher.publish(null, "IOC_MATCH", Map.of()));
        assertThrows(ValidationException.class, () -> publisher.publish("org-1", "IOC_MATCH", null));
        verifyNoInteractions(transport);
    }

    @Test
    @DisplayName("传输层拒绝时抛出发布异常")
    void testTransportFailure() {
        doThrow(new EventPublishException("refused", null)).when(transport).publish(anyString(), any());

        assertThrows(EventPublishException.class,
            () -> publisher.publish("org-1", "IOC_MATCH", Map.of("k", "v")));
    }
}
