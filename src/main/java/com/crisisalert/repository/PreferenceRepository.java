package com.crisisalert.repository;

import com.crisisalert.domain.model.NotificationPreferences;
import java.util.List;
import java.util.Optional;

/**
 * Key-value persistence of NotificationPreferences keyed by userId.
 *
 * <p>Implementations: {@link com.crisisalert.repository.jpa.JpaPreferenceRepository}
 * (durable, default) and {@link com.crisisalert.repository.memory.InMemoryPreferenceRepository},
 * selected with {@code crisisalert.notifications.preference-store}.
 */
public interface PreferenceRepository {

    Optional<NotificationPreferences> findByUserId(String userId);

    /** Replaces any stored record for the same user. */
    NotificationPreferences save(NotificationPreferences preferences);

    void deleteByUserId(String userId);

    List<NotificationPreferences> findAll();
}
