package com.secops.threatintel.controller;

import com.secops.threatintel.dto.ApiResponse;
import com.secops.threatintel.dto.SubscribeRequest;
import com.secops.threatintel.exception.ValidationException;
import com.secops.threatintel.security.AccessPolicy;
import com.secops.threatintel.security.IdentityContext;
import com.secops.threatintel.security.Role;
import com.secops.threatintel.subscription.DomainEvent;
import com.secops.threatintel.subscription.EventSink;
import com.secops.threatintel.subscription.SubscriptionDispatcher;
import com.secops.threatintel.subscription.SubscriptionHandle;
import com.secops.threatintel.subscription.SubscriptionHealthMonitor;
import com.secops.threatintel.subscription.SubscriptionRegistration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 事件订阅 API（SSE）
 */
@Slf4j
@RestController
@RequestMapping("/api/subscriptions")
@RequiredArgsConstructor
public class SubscriptionController {

    /** 连接不设超时，由心跳清理回收 */
    private static final long NO_TIMEOUT = 0L;

    private final SubscriptionDispatcher dispatcher;
    private final SubscriptionHealthMonitor healthMonitor;
    private final AccessPolicy accessPolicy;

    /**
     * 建立订阅；首个 SSE 事件 "subscribed" 携带 connectionId
     */
    @PostMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribe(IdentityContext identity, @RequestBody SubscribeRequest request) throws IOException {
        if (request == null) {
            throw new ValidationException("subscription request is required");
        }
        SseEmitter emitter = new SseEmitter(NO_TIMEOUT);
        SseEventSink sink = new SseEventSink(emitter);
        String organizationId = request.getOrganizationId() != null
            ? request.getOrganizationId()
            : identity != null ? identity.organizationId() : null;

        SubscriptionHandle handle = dispatcher.subscribe(identity, request.getBaseTopic(), organizationId,
            request.getFilter(), sink);
        sink.bind(handle.connectionId());

        emitter.onCompletion(() -> dispatcher.unsubscribe(handle.connectionId()));
        emitter.onTimeout(() -> dispatcher.unsubscribe(handle.connectionId()));
        emitter.onError(e -> dispatcher.unsubscribe(handle.connectionId()));

        Map<String, Object> opened = new LinkedHashMap<>();
        opened.put("connectionId", handle.connectionId());
        opened.put("topic", handle.topic());
        emitter.send(SseEmitter.event().name("subscribed").data(opened, MediaType.APPLICATION_JSON));
        return emitter;
    }

    /**
     * 心跳；连接不存在时返回 false
     */
    @PostMapping("/{connectionId}/ping")
    public ApiResponse<Boolean> ping(IdentityContext identity, @PathVariable String connectionId) {
        if (!ownedConnection(identity, connectionId)) {
            return ApiResponse.success(false);
        }
        return ApiResponse.success(dispatcher.ping(connectionId));
    }

    @DeleteMapping("/{connectionId}")
    public ApiResponse<Boolean> unsubscribe(IdentityContext identity, @PathVariable String connectionId) {
        if (!ownedConnection(identity, connectionId)) {
            return ApiResponse.success(false);
        }
        log.info("Unsubscribe requested: connectionId={}, user={}", connectionId, identity.userId());
        return ApiResponse.success(dispatcher.unsubscribe(connectionId));
    }

    /**
     * 订阅统计
     */
    @GetMapping("/stats")
    public ApiResponse<Map<String, Object>> stats(IdentityContext identity) {
        accessPolicy.authorize(identity, Role.ANALYST);
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("health", healthMonitor.getSubscriptionStats());
        stats.put("dispatch", dispatcher.stats());
        return ApiResponse.success(stats);
    }

    /**
     * 校验调用方可以操作该连接：连接所属组织必须与调用方一致，SUPER_ADMIN 除外
     */
    private boolean ownedConnection(IdentityContext identity, String connectionId) {
        accessPolicy.authorize(identity, Role.VIEWER);
        Optional<SubscriptionRegistration> registration = dispatcher.registration(connectionId);
        if (registration.isEmpty()) {
            return false;
        }
        accessPolicy.checkOrganization(identity, registration.get().getOrganizationId());
        return true;
    }

    /**
     * SseEmitter 出口
     */
    static final class SseEventSink implements EventSink {

        private final SseEmitter emitter;
        private final AtomicReference<String> connectionId = new AtomicReference<>();

        SseEventSink(SseEmitter emitter) {
            this.emitter = emitter;
        }

        void bind(String id) {
            connectionId.set(id);
        }

        @Override
        public void send(DomainEvent event) throws IOException {
            emitter.send(SseEmitter.event()
                .id(event.getEventId())
                .name(event.getBaseTopic())
                .data(event, MediaType.APPLICATION_JSON));
        }

        @Override
        public void close() {
            try {
                emitter.complete();
            } catch (IllegalStateException e) {
                log.debug("Emitter already completed: connectionId={}", connectionId.get());
            }
        }
    }
}
