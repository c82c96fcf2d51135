package com.example.feedpipeline.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
public class FeedExecutorConfig {

    @Bean(name = "feedExecutor")
    public Executor feedExecutor(@Value("${app.feeds.worker-pool-size:4}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        // 固定大小：每个 feed 占一个线程
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        // 超出线程数的 feed 排队等待
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("Feed-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
