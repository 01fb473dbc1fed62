package com.crisisalert.repository.memory;

import com.crisisalert.domain.model.EmergencyContact;
import com.crisisalert.domain.model.NotificationPreferences;
import com.crisisalert.domain.model.QuietHours;
import com.crisisalert.repository.PreferenceRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * Non-durable {@link PreferenceRepository}. Stores copies so callers cannot mutate
 * the stored record behind the store's back.
 */
@Repository
@ConditionalOnProperty(name = "crisisalert.notifications.preference-store", havingValue = "memory")
public class InMemoryPreferenceRepository implements PreferenceRepository {

    private final ConcurrentHashMap<String, NotificationPreferences> preferencesByUser = new ConcurrentHashMap<>();

    @Override
    public Optional<NotificationPreferences> findByUserId(String userId) {
        return Optional.ofNullable(preferencesByUser.get(userId)).map(InMemoryPreferenceRepository::copy);
    }

    @Override
    public NotificationPreferences save(NotificationPreferences preferences) {
        preferencesByUser.put(preferences.getUserId(), copy(preferences));
        return copy(preferences);
    }

    @Override
    public void deleteByUserId(String userId) {
        preferencesByUser.remove(userId);
    }

    @Override
    public List<NotificationPreferences> findAll() {
        return preferencesByUser.values().stream()
                .map(InMemoryPreferenceRepository::copy)
                .toList();
    }

    private static NotificationPreferences copy(NotificationPreferences source) {
        List<EmergencyContact> contacts = new ArrayList<>();
        if (source.getEmergencyContacts() != null) {
            source.getEmergencyContacts().forEach(contact -> contacts.add(contact.toBuilder().build()));
        }
        QuietHours quietHours =
                source.getQuietHours() != null ? source.getQuietHours().toBuilder().build() : null;
        return source.toBuilder()
                .quietHours(quietHours)
                .emergencyContacts(contacts)
                .build();
    }
}
