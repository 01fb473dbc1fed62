package com.crisisalert.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for channel fan-out and the emergency-contact cascade.
 *
 * <p>A saturated pool rejects new work instead of running it on the submitting thread.
 * {@code ChannelDispatcher} records a rejected channel as UNAVAILABLE and carries on with
 * the rest, {@code EscalationCascade} falls back to contacting inline.
 */
@Configuration
public class AsyncConfig {

    @Value("${crisisalert.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${crisisalert.async.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${crisisalert.async.queue-capacity:200}")
    private int queueCapacity;

    @Bean("notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("notify-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
