package com.secops.threatintel.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池与时钟配置
 */
@Configuration
public class ExecutorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * {@code @Scheduled} 统计日志使用
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("stats-reporter-");
        scheduler.setDaemon(true);
        return scheduler;
    }

    /**
     * 微批窗口调度
     */
    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService batchDispatchScheduler() {
        return Executors.newScheduledThreadPool(2, namedDaemon("batch-dispatch"));
    }

    /**
     * 存储适配器批量拉取
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService storageFetchExecutor(ThreatIntelProperties properties) {
        return Executors.newFixedThreadPool(properties.getOptimizer().getResolverThreads(),
            namedDaemon("storage-fetch"));
    }

    /**
     * 关系字段并行解析
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService resolverExecutor(ThreatIntelProperties properties) {
        return Executors.newFixedThreadPool(properties.getOptimizer().getResolverThreads(),
            namedDaemon("field-resolver"));
    }

    /**
     * 订阅事件投递
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService deliveryExecutor(ThreatIntelProperties properties) {
        return Executors.newFixedThreadPool(properties.getSubscription().getDeliveryThreads(),
            namedDaemon("event-delivery"));
    }

    static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
