package com.secops.threatintel.config;

import com.secops.threatintel.repository.InMemoryStorageAdapter;
import com.secops.threatintel.repository.StorageAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 存储适配器配置，持久层提供自己的 StorageAdapter 时不生效
 */
@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    @ConditionalOnMissingBean(StorageAdapter.class)
    public StorageAdapter storageAdapter() {
        log.warn("No StorageAdapter provided, using in-memory storage");
        return new InMemoryStorageAdapter();
    }
}
