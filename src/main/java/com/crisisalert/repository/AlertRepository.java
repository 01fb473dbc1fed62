package com.crisisalert.repository;

import com.crisisalert.domain.model.Alert;
import java.util.List;
import java.util.Optional;

/**
 * Storage for tracked alerts.
 *
 * <p>Only {@link com.crisisalert.notification.AlertLifecycleTracker} writes through this
 * interface, always while holding the per-alert lock, so implementations need
 * thread-safe collections but no locking of their own.
 */
public interface AlertRepository {

    Optional<Alert> findById(String id);

    Alert save(Alert alert);

    void deleteById(String id);

    List<Alert> findAll();

    List<Alert> findByUserId(String userId);
}
