package com.crisisalert.notification;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Removes tracked alerts whose {@code expiresAt} has passed, whatever their status.
 * An armed quiet-hours or snooze timer for an expired alert is cancelled with it.
 *
 * <p>Runs every {@code crisisalert.notifications.expiry-sweep-interval-ms} (default 60s).
 */
@Component
public class AlertExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(AlertExpirySweeper.class);

    private final AlertLifecycleTracker alertLifecycleTracker;
    private final Clock clock;

    public AlertExpirySweeper(AlertLifecycleTracker alertLifecycleTracker, Clock clock) {
        this.alertLifecycleTracker = alertLifecycleTracker;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${crisisalert.notifications.expiry-sweep-interval-ms:60000}")
    public void sweep() {
        int removed = alertLifecycleTracker.removeExpired(clock.instant());
        if (removed > 0) {
            log.info("Expired alerts removed: count={}", removed);
        }
    }
}
