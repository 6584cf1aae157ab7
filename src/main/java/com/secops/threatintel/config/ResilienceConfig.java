package com.secops.threatintel.config;

import com.secops.threatintel.constant.CacheConstants;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * SHARED 层熔断配置
 * Redis 不可用时快速失败，读路径按未命中处理
 */
@Configuration
public class ResilienceConfig {

    private static final Logger log = LoggerFactory.getLogger(ResilienceConfig.class);

    private static final float FAILURE_RATE_THRESHOLD = 50.0f;
    private static final int SLOW_CALL_RATE_THRESHOLD = 80;
    private static final Duration SLOW_CALL_DURATION_THRESHOLD = Duration.ofMillis(100);
    private static final int MINIMUM_CALLS = 10;
    private static final Duration WAIT_DURATION_IN_OPEN_STATE = Duration.ofSeconds(30);

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .failureRateThreshold(FAILURE_RATE_THRESHOLD)
            .slowCallRateThreshold(SLOW_CALL_RATE_THRESHOLD)
            .slowCallDurationThreshold(SLOW_CALL_DURATION_THRESHOLD)
            .minimumNumberOfCalls(MINIMUM_CALLS)
            .waitDurationInOpenState(WAIT_DURATION_IN_OPEN_STATE)
            .permittedNumberOfCallsInHalfOpenState(5)
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(100)
            .build();
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public CircuitBreaker sharedCacheCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreaker breaker = registry.circuitBreaker(CacheConstants.SHARED_CIRCUIT_BREAKER);
        breaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Shared cache circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()));
        return breaker;
    }
}
