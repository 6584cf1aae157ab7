package com.secops.threatintel.subscription;

import com.secops.threatintel.config.ThreatIntelProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * 订阅后台清理任务测试
 */
@ExtendWith(MockitoExtension.class)
class SubscriptionMaintenanceSchedulerTest {

    @Mock
    private SubscriptionRateLimiter rateLimiter;

    @Mock
    private SubscriptionHealthMonitor healthMonitor;

    @Mock
    private SubscriptionDispatcher dispatcher;

    private SubscriptionMaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new SubscriptionMaintenanceScheduler(rateLimiter, healthMonitor, dispatcher,
            new ThreatIntelProperties());
    }

    @Test
    @DisplayName("陈旧订阅清理：先移除订阅登记，再清理元数据")
    void testStaleSweep() {
        when(healthMonitor.cleanupStaleSubscriptions(anyLong())).thenReturn(2);
        when(dispatcher.evictStale(anyLong())).thenReturn(2);

        scheduler.sweepStaleSubscriptions();

        InOrder order = inOrder(dispatcher, healthMonitor);
        order.verify(dispatcher).evictStale(300_000L);
        order.verify(healthMonitor).cleanupStaleSubscriptions(300_000L);
    }

    @Test
    @DisplayName("限流窗口按保留时长清理")
    void testWindowSweep() {
        scheduler.sweepRateLimitWindows();

        verify(rateLimiter).cleanupExpiredWindows(Duration.ofMinutes(2));
    }

    @Test
    @DisplayName("清理异常不向外抛出")
    void testSweepFailureContained() {
        when(healthMonitor.cleanupStaleSubscriptions(anyLong())).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> scheduler.sweepStaleSubscriptions());
    }

    @Test
    @DisplayName("启动与停止")
    void testLifecycle() {
        scheduler.start();
        assertTrue(scheduler.isRunning());

        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }
}
