package com.secops.threatintel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 数据访问层配置属性
 */
@Data
@Component
@ConfigurationProperties(prefix = "threatintel")
public class ThreatIntelProperties {

    /** 查询优化阈值 */
    private OptimizerConfig optimizer = new OptimizerConfig();

    /** 分层结果缓存 */
    private CacheConfig cache = new CacheConfig();

    /** 查询性能监控 */
    private MonitorConfig monitor = new MonitorConfig();

    /** 订阅分发 */
    private SubscriptionConfig subscription = new SubscriptionConfig();

    /** 发布订阅传输 */
    private PubSubConfig pubsub = new PubSubConfig();

    @Data
    public static class OptimizerConfig {
        /** 复杂度超过该值使用 AGGRESSIVE_CACHING */
        private int aggressiveCachingComplexity = 100;
        /** 批量机会数超过该值使用 BATCHING_FOCUSED */
        private int batchingFocusedOpportunities = 3;
        /** 关系字段种类超过该值使用 DATALOADER_INTENSIVE */
        private int dataloaderRelationships = 5;
        /** 复杂度超过该值使用 EXTENDED 缓存级别 */
        private int extendedCachingComplexity = 50;
        /** STANDARD 策略下开启并行解析的复杂度阈值 */
        private int parallelExecutionComplexity = 30;
        /** 高收益批量机会阈值 */
        private double highBenefitThreshold = 0.7;
        private int highBenefitBatchSize = 50;
        private int standardBatchSize = 25;
        /** 未调优字段的最大批次 */
        private int defaultMaxBatchSize = 100;
        /** 微批窗口 */
        private Duration batchWindow = Duration.ofMillis(2);
        /** 单个解析任务超时 */
        private Duration resolverTimeout = Duration.ofSeconds(10);
        /** 并行解析线程数 */
        private int resolverThreads = 16;
    }

    @Data
    public static class CacheConfig {
        private String keyPrefix = "ti";
        private long localMaxSize = 10_000;
        private Duration localTtl = Duration.ofMinutes(5);
        private Duration normalTtl = Duration.ofMinutes(5);
        private Duration extendedTtl = Duration.ofMinutes(15);
        private Duration aggressiveTtl = Duration.ofHours(1);
        private BroadcastConfig broadcast = new BroadcastConfig();
    }

    @Data
    public static class BroadcastConfig {
        /** 是否通过 RocketMQ 广播本地缓存失效 */
        private boolean enabled = false;
        private String topic = "TI_LOCAL_CACHE_INVALIDATE_TOPIC";
    }

    @Data
    public static class MonitorConfig {
        /** 保留最近完成查询数 */
        private int recentCapacity = 1000;
        private Duration infoQueryThreshold = Duration.ofSeconds(1);
        private Duration slowQueryThreshold = Duration.ofSeconds(5);
        private Duration criticalQueryThreshold = Duration.ofSeconds(10);
        /** 仪表盘快照输出间隔（毫秒） */
        private long dashboardInterval = 60_000;
    }

    @Data
    public static class SubscriptionConfig {
        /** 每组织每主题每分钟最大事件数 */
        private int maxEventsPerMinute = 60;
        /** 心跳超过该时长视为陈旧 */
        private Duration staleAfter = Duration.ofMinutes(5);
        private Duration sweepInterval = Duration.ofMinutes(1);
        /** 限流窗口保留时长 */
        private Duration windowRetention = Duration.ofMinutes(2);
        private int deliveryThreads = 8;
    }

    @Data
    public static class PubSubConfig {
        /** redis 或 in-memory */
        private String transport = "redis";
        /** Redis 频道前缀 */
        private String channelPrefix = "ti:events:";
    }
}
