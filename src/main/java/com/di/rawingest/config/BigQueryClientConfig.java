package com.di.rawingest.config;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Registers a BigQuery client bean backed by Application Default Credentials.
 *
 * <p>Only the destination-table lookup uses it; the load itself goes through BigQueryIO.
 * Lazy so that a run which stops at the input check never builds a client.</p>
 */
@Configuration
public class BigQueryClientConfig {

    @Bean
    @Lazy
    @ConditionalOnMissingBean(BigQuery.class)
    public BigQuery bigQueryClient() {
        return BigQueryOptions.getDefaultInstance().getService();
    }
}
