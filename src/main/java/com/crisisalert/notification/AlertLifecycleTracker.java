package com.crisisalert.notification;

import com.crisisalert.domain.enums.AlertStatus;
import com.crisisalert.domain.enums.DeferralKind;
import com.crisisalert.domain.model.Alert;
import com.crisisalert.domain.model.ContactNotification;
import com.crisisalert.domain.model.CrisisAlert;
import com.crisisalert.event.AlertEventPublisher;
import com.crisisalert.exception.InvalidAlertException;
import com.crisisalert.notification.scheduling.DeferredTask;
import com.crisisalert.notification.scheduling.DeferredTaskScheduler;
import com.crisisalert.repository.AlertRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single source of truth for alert state.
 *
 * <p>Every mutation of an alert runs under that alert's own {@link ReentrantLock}; there is
 * no lock spanning alerts or users. Dispatch results, timer callbacks and user actions for
 * the same id are therefore serialised, while different alerts proceed in parallel.
 * Callers only ever see {@link Alert#snapshot()} copies.
 *
 * <p><b>Deferred tasks:</b> at most one timer (quiet-hours deferral or snooze) is armed per
 * alert. Each arming draws a new generation number. A timer that fires must claim its
 * generation under the lock before it may deliver; {@link #dismiss}, {@link #acknowledge},
 * re-arming and the expiry sweep remove the armed entry, so a timer that lost that race
 * finds a different (or no) generation and drops out. Cancelling the handle only saves the
 * wake-up; the generation check is what guarantees a dismissed alert is never delivered.
 */
@Service
public class AlertLifecycleTracker {

    private static final Logger log = LoggerFactory.getLogger(AlertLifecycleTracker.class);

    private final AlertRepository alertRepository;
    private final DeferredTaskScheduler deferredTaskScheduler;
    private final AlertEventPublisher alertEventPublisher;
    private final Clock clock;

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ArmedTask> armedTasks = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();

    public AlertLifecycleTracker(
            AlertRepository alertRepository,
            DeferredTaskScheduler deferredTaskScheduler,
            AlertEventPublisher alertEventPublisher,
            Clock clock) {
        this.alertRepository = alertRepository;
        this.deferredTaskScheduler = deferredTaskScheduler;
        this.alertEventPublisher = alertEventPublisher;
        this.clock = clock;
    }

    /**
     * Starts tracking a freshly built alert. The tracker keeps its own copy.
     *
     * @throws InvalidAlertException if the id is missing or already tracked
     */
    public Alert register(Alert alert) {
        if (alert.getId() == null) {
            throw new InvalidAlertException("Alert has no id");
        }
        return withLock(alert.getId(), () -> {
            if (alertRepository.findById(alert.getId()).isPresent()) {
                throw new InvalidAlertException("Alert already tracked: " + alert.getId());
            }
            Alert tracked = alert.snapshot();
            alertRepository.save(tracked);
            log.debug(
                    "Alert registered: alertId={}, userId={}, type={}",
                    tracked.getId(),
                    tracked.getUserId(),
                    tracked.getType());
            return tracked.snapshot();
        });
    }

    public Optional<Alert> find(String id) {
        return ifTracked(id, Alert::snapshot);
    }

    /** Marks the alert READ from any state and drops any armed timer. */
    public Optional<Alert> acknowledge(String id) {
        return ifTracked(id, alert -> {
            disarm(id);
            transition(alert, AlertStatus.READ);
            return alert.snapshot();
        });
    }

    /** Marks the alert DISMISSED from any state and cancels any armed timer. */
    public Optional<Alert> dismiss(String id) {
        return ifTracked(id, alert -> {
            if (disarm(id)) {
                log.info("Dismissed alert had a pending delivery, cancelled: alertId={}", id);
            }
            transition(alert, AlertStatus.DISMISSED);
            return alert.snapshot();
        });
    }

    /** PENDING to DISMISSED because the user disabled the alert's category. */
    public void markSuppressed(String id) {
        withLock(id, () -> {
            alertRepository.findById(id).ifPresent(alert -> {
                transition(alert, AlertStatus.DISMISSED);
                log.info("Alert suppressed by preferences: alertId={}, type={}", id, alert.getType());
            });
            return null;
        });
    }

    /**
     * Dismisses the alert now and arms a timer that resets it to PENDING and hands it to
     * {@code redeliver} once {@code duration} has elapsed.
     */
    public Optional<Alert> snooze(String id, Duration duration, Consumer<Alert> redeliver) {
        return ifTracked(id, alert -> {
            Instant wakeAt = clock.instant().plus(duration);
            transition(alert, AlertStatus.DISMISSED);
            armLocked(id, wakeAt, DeferralKind.SNOOZE, redeliver);
            log.info("Alert snoozed: alertId={}, until={}", id, wakeAt);
            return alert.snapshot();
        });
    }

    /**
     * Arms a timer for {@code at}, replacing any timer already armed for the alert.
     *
     * @return false when the alert is not tracked
     */
    public boolean armDeferred(String id, Instant at, DeferralKind kind, Consumer<Alert> onFire) {
        return withLock(id, () -> {
            if (alertRepository.findById(id).isEmpty()) {
                return false;
            }
            armLocked(id, at, kind, onFire);
            return true;
        });
    }

    public boolean hasArmedTask(String id) {
        return armedTasks.containsKey(id);
    }

    /** When the armed timer for the alert is due, if one is armed. */
    public Optional<Instant> getDeferredUntil(String id) {
        return Optional.ofNullable(armedTasks.get(id)).map(armed -> armed.task().getScheduledFor());
    }

    /**
     * Applies a dispatch result. The status only moves if the alert is still PENDING: when
     * the user read or dismissed it while channels were in flight, their action stands.
     */
    public void recordDispatchOutcome(String id, DispatchResult result) {
        withLock(id, () -> {
            Optional<Alert> found = alertRepository.findById(id);
            if (found.isEmpty()) {
                log.debug("Dispatch finished for untracked alert: alertId={}", id);
                return null;
            }

            Alert alert = found.get();
            alert.setChannelOutcomes(new LinkedHashMap<>(result.outcomes()));
            alert.setDeliveryAttempts(alert.getDeliveryAttempts() + 1);

            if (alert.getStatus() == AlertStatus.PENDING) {
                transition(alert, result.resultingStatus());
            } else {
                alertRepository.save(alert);
                log.debug(
                        "Dispatch outcome kept status set meanwhile: alertId={}, status={}",
                        id,
                        alert.getStatus());
            }
            return null;
        });
    }

    /** SENT to DELIVERED once the client confirms receipt. Other states are left alone. */
    public Optional<Alert> markDelivered(String id) {
        return ifTracked(id, alert -> {
            if (alert.getStatus() == AlertStatus.SENT) {
                transition(alert, AlertStatus.DELIVERED);
            }
            return alert.snapshot();
        });
    }

    /** Records the cascade's contact attempts and flags the alert as escalated. */
    public void markEmergencyContactsNotified(String id, List<ContactNotification> attempts) {
        withLock(id, () -> {
            alertRepository.findById(id).ifPresent(alert -> {
                if (alert instanceof CrisisAlert crisisAlert) {
                    crisisAlert.setEmergencyContactsNotified(true);
                    crisisAlert.getContactNotifications().addAll(attempts);
                } else {
                    alert.getData().put(EscalationCascade.CONTACTS_NOTIFIED_KEY, Boolean.TRUE);
                }
                alertRepository.save(alert);
            });
            return null;
        });
    }

    /** PENDING, SENT and DELIVERED alerts of the user, newest first. */
    public List<Alert> getActiveAlerts(String userId) {
        List<Alert> active = new ArrayList<>();
        for (Alert candidate : alertRepository.findByUserId(userId)) {
            withLock(candidate.getId(), () -> {
                alertRepository.findById(candidate.getId())
                        .filter(alert -> alert.getStatus().isActive())
                        .ifPresent(alert -> active.add(alert.snapshot()));
                return null;
            });
        }
        active.sort(Comparator.comparing(Alert::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder())));
        return active;
    }

    /**
     * Drops every alert whose expiry has passed, whatever its status, together with any armed timer.
     *
     * @return number of alerts removed
     */
    public int removeExpired(Instant now) {
        int removed = 0;
        for (Alert candidate : alertRepository.findAll()) {
            String id = candidate.getId();
            boolean expired = withLock(id, () -> {
                Optional<Alert> current = alertRepository.findById(id);
                if (current.isEmpty() || !current.get().isExpired(now)) {
                    return false;
                }
                disarm(id);
                alertRepository.deleteById(id);
                return true;
            });
            if (expired) {
                locks.remove(id);
                removed++;
            }
        }
        return removed;
    }

    public int getTrackedCount() {
        return alertRepository.findAll().size();
    }

    private void armLocked(String id, Instant at, DeferralKind kind, Consumer<Alert> onFire) {
        disarm(id);
        long generation = generations.incrementAndGet();
        // The task cannot claim before the entry below is in place: it needs this alert's lock.
        DeferredTask task = deferredTaskScheduler.schedule(() -> fire(id, generation, onFire), at);
        armedTasks.put(id, new ArmedTask(generation, kind, task));
        log.debug("Deferred task armed: alertId={}, kind={}, at={}", id, kind, at);
    }

    private boolean disarm(String id) {
        ArmedTask armed = armedTasks.remove(id);
        if (armed == null) {
            return false;
        }
        armed.task().cancel();
        return true;
    }

    private void fire(String id, long generation, Consumer<Alert> onFire) {
        Optional<Alert> claimed = claim(id, generation);
        if (claimed.isEmpty()) {
            return;
        }
        try {
            onFire.accept(claimed.get());
        } catch (Exception e) {
            log.error("Deferred delivery failed: alertId={}, error={}", id, e.getMessage(), e);
        }
    }

    private Optional<Alert> claim(String id, long generation) {
        return withLock(id, () -> {
            ArmedTask armed = armedTasks.get(id);
            if (armed == null || armed.generation() != generation) {
                log.debug("Stale deferred task ignored: alertId={}, generation={}", id, generation);
                return Optional.<Alert>empty();
            }
            armedTasks.remove(id);

            Optional<Alert> found = alertRepository.findById(id);
            if (found.isEmpty()) {
                return Optional.<Alert>empty();
            }

            Alert alert = found.get();
            if (alert.isExpired(clock.instant())) {
                log.info("Deferred alert expired before delivery: alertId={}", id);
                return Optional.<Alert>empty();
            }

            if (armed.kind() == DeferralKind.SNOOZE) {
                AlertStatus previous = alert.getStatus();
                alert.resetForRedelivery();
                alertRepository.save(alert);
                alertEventPublisher.publishStatusChanged(this, alert, previous);
                log.info("Snooze elapsed, alert resubmitted: alertId={}", id);
                return Optional.of(alert.snapshot());
            }

            if (alert.getStatus() != AlertStatus.PENDING) {
                return Optional.<Alert>empty();
            }
            return Optional.of(alert.snapshot());
        });
    }

    private void transition(Alert alert, AlertStatus next) {
        AlertStatus previous = alert.getStatus();
        if (previous == next) {
            return;
        }
        alert.setStatus(next);
        alertRepository.save(alert);
        alertEventPublisher.publishStatusChanged(this, alert, previous);
        log.debug("Alert status changed: alertId={}, {} -> {}", alert.getId(), previous, next);
    }

    /** Skips the lock entirely for unknown ids so lookups of stale ids leave no lock behind. */
    private <T> Optional<T> ifTracked(String id, Function<Alert, T> action) {
        if (alertRepository.findById(id).isEmpty()) {
            return Optional.empty();
        }
        return withLock(id, () -> alertRepository.findById(id).map(action));
    }

    private <T> T withLock(String id, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(id, key -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private record ArmedTask(long generation, DeferralKind kind, DeferredTask task) {}
}
