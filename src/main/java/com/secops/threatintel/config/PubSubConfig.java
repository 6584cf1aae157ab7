package com.secops.threatintel.config;

import com.secops.threatintel.subscription.transport.InMemoryPubSubTransport;
import com.secops.threatintel.subscription.transport.PubSubTransport;
import com.secops.threatintel.subscription.transport.RedisPubSubTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executors;

/**
 * 发布订阅传输配置
 * threatintel.pubsub.transport=redis（默认）或 in-memory
 */
@Configuration
public class PubSubConfig {

    private static final Logger log = LoggerFactory.getLogger(PubSubConfig.class);

    @Configuration
    @ConditionalOnProperty(prefix = "threatintel.pubsub", name = "transport", havingValue = "redis", matchIfMissing = true)
    static class RedisTransportConfig {

        /**
         * 监听线程池，随容器关闭
         */
        @Bean
        public ThreadPoolTaskExecutor redisListenerExecutor() {
            ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
            executor.setCorePoolSize(4);
            executor.setMaxPoolSize(4);
            executor.setThreadNamePrefix("redis-listener-");
            executor.setDaemon(true);
            executor.setWaitForTasksToCompleteOnShutdown(true);
            executor.setAwaitTerminationSeconds(5);
            return executor;
        }

        @Bean
        public RedisMessageListenerContainer eventListenerContainer(RedisConnectionFactory connectionFactory,
                                                                    @Qualifier("redisListenerExecutor") ThreadPoolTaskExecutor redisListenerExecutor) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(connectionFactory);
            container.setTaskExecutor(redisListenerExecutor);
            return container;
        }

        @Bean
        public PubSubTransport pubSubTransport(StringRedisTemplate redisTemplate,
                                               RedisMessageListenerContainer eventListenerContainer,
                                               ThreatIntelProperties properties) {
            log.info("Pub/sub transport: redis, channelPrefix={}", properties.getPubsub().getChannelPrefix());
            return new RedisPubSubTransport(redisTemplate, eventListenerContainer,
                properties.getPubsub().getChannelPrefix());
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "threatintel.pubsub", name = "transport", havingValue = "in-memory")
    static class InMemoryTransportConfig {

        @Bean
        public PubSubTransport pubSubTransport() {
            log.info("Pub/sub transport: in-memory");
            return new InMemoryPubSubTransport(
                Executors.newSingleThreadExecutor(ExecutorConfig.namedDaemon("in-memory-pubsub")));
        }
    }
}
