package com.example.feedpipeline.config;

import com.example.feedpipeline.source.InMemoryRecordSource;
import com.example.feedpipeline.source.RecordSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 未提供外部数据源时使用内存数据源。
 */
@Configuration
public class RecordSourceConfig {

    @Bean
    @ConditionalOnMissingBean(RecordSource.class)
    public InMemoryRecordSource inMemoryRecordSource() {
        return new InMemoryRecordSource();
    }
}
