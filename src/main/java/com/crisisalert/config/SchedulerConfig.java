package com.crisisalert.config;

import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Time sources for the engine: the {@link Clock} every component reads "now" from, and
 * the task scheduler backing quiet-hours deferrals, snooze timers and the expiry sweep.
 */
@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock(NotificationProperties notificationProperties) {
        return Clock.system(notificationProperties.resolveZone());
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler(
            @Value("${crisisalert.scheduler.pool-size:2}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("deferred-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
