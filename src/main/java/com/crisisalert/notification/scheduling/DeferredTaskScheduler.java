package com.crisisalert.notification.scheduling;

import java.time.Instant;

/**
 * Cancellable delayed execution used for quiet-hours deferrals and snooze timers.
 *
 * <p>Implementations must run the task on a different thread from the caller of
 * {@link #schedule}, even when {@code at} is already in the past; the lifecycle tracker
 * schedules while holding the alert's lock and registers the handle afterwards.
 */
public interface DeferredTaskScheduler {

    DeferredTask schedule(Runnable task, Instant at);
}
