package com.bizpulse.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class ExecutorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool for alert handler calls. On shutdown it lets in-flight handlers finish for
     * {@code anomaly.alerting.shutdown-grace-seconds} before abandoning them.
     */
    @Bean(name = "alertDispatchExecutor")
    public ThreadPoolTaskExecutor alertDispatchExecutor(AlertingProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getDispatchThreads());
        executor.setMaxPoolSize(properties.getDispatchThreads());
        executor.setQueueCapacity(properties.getDispatchQueueCapacity());
        executor.setThreadNamePrefix("alert-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getShutdownGraceSeconds());
        executor.initialize();
        return executor;
    }
}
