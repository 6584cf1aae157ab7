package com.secops.threatintel.health;

import com.secops.threatintel.service.LocalCacheTier;
import com.secops.threatintel.service.SharedCacheTier;
import com.secops.threatintel.subscription.transport.PubSubTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 数据访问层健康检查：LOCAL 层、SHARED 层、发布订阅传输
 */
@Slf4j
@Component("threatIntelHealthIndicator")
@RequiredArgsConstructor
public class ThreatIntelHealthIndicator implements HealthIndicator {

    private final LocalCacheTier localCacheTier;
    private final SharedCacheTier sharedCacheTier;
    private final PubSubTransport pubSubTransport;

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        boolean allHealthy = true;

        // 1. LOCAL 为进程内缓存，只报告容量
        details.put("local_cache", "UP");
        details.put("local_size", localCacheTier.size());

        // 2. SHARED
        try {
            boolean sharedHealthy = sharedCacheTier.ping();
            details.put("shared_cache", sharedHealthy ? "UP" : "DOWN");
            details.put("shared_circuit", sharedCacheTier.circuitState());
            if (!sharedHealthy) allHealthy = false;
        } catch (Exception e) {
            log.error("Shared cache health check failed", e);
            details.put("shared_cache", "DOWN");
            details.put("shared_error", e.getMessage());
            allHealthy = false;
        }

        // 3. 传输层
        boolean transportHealthy = pubSubTransport.isHealthy();
        details.put("pubsub_transport", pubSubTransport.name());
        details.put("pubsub_status", transportHealthy ? "UP" : "DOWN");
        if (!transportHealthy) allHealthy = false;

        if (allHealthy) {
            return Health.up().withDetails(details).build();
        }
        return Health.down().withDetails(details).build();
    }
}
