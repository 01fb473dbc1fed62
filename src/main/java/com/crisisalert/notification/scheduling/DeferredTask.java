package com.crisisalert.notification.scheduling;

import java.time.Instant;

/** Handle to a delayed task. Cancelling before it fires guarantees it never runs. */
public interface DeferredTask {

    Instant getScheduledFor();

    /** @return false if the task already ran or was already cancelled */
    boolean cancel();

    boolean isCancelled();
}
