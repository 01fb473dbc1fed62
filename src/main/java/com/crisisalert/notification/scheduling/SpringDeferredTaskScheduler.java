package com.crisisalert.notification.scheduling;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/** {@link DeferredTaskScheduler} backed by the application's {@link TaskScheduler}. */
@Component
public class SpringDeferredTaskScheduler implements DeferredTaskScheduler {

    private final TaskScheduler taskScheduler;

    public SpringDeferredTaskScheduler(TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    @Override
    public DeferredTask schedule(Runnable task, Instant at) {
        ScheduledFuture<?> future = taskScheduler.schedule(task, at);
        return new FutureDeferredTask(future, at);
    }

    private record FutureDeferredTask(ScheduledFuture<?> future, Instant scheduledFor) implements DeferredTask {

        @Override
        public Instant getScheduledFor() {
            return scheduledFor;
        }

        @Override
        public boolean cancel() {
            return future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
