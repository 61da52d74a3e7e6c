package com.streamrelay.streamrelay.service.storage;

import com.streamrelay.streamrelay.config.StorageProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StorageConfig {

    @Bean
    public StorageBackend storageBackend(StorageBackendSelector selector, StorageProperties properties) {
        return selector.select(properties);
    }
}
