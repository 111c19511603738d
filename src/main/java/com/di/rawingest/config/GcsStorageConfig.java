package com.di.rawingest.config;

import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Registers a Google Cloud Storage client bean backed by
 * Application Default Credentials (ADC).
 *
 * <p>Used for the existence check of {@code gs://} inputs.</p>
 */
@Configuration
public class GcsStorageConfig {

    @Bean
    @Lazy
    @ConditionalOnMissingBean(Storage.class)
    public Storage gcsStorage() {
        return StorageOptions.getDefaultInstance().getService();
    }
}
