package com.calcron.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class AppConfig {

    /**
     * All reference instants are taken in UTC.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "actionApplyExecutor")
    public ThreadPoolTaskExecutor actionApplyExecutor(SyncProperties properties) {
        int parallelism = Math.max(1, properties.getApplyParallelism());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("calcron-apply-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
