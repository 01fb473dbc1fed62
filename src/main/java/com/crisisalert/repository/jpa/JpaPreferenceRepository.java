package com.crisisalert.repository.jpa;

import com.crisisalert.domain.model.NotificationPreferences;
import com.crisisalert.entity.NotificationPreferencesEntity;
import com.crisisalert.mapper.NotificationPreferencesMapper;
import com.crisisalert.repository.PreferenceRepository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable {@link PreferenceRepository} over the notification_preferences table.
 * Saving overwrites the existing row for the user, keeping its id and created_at.
 */
@Repository
@ConditionalOnProperty(
        name = "crisisalert.notifications.preference-store",
        havingValue = "jpa",
        matchIfMissing = true)
public class JpaPreferenceRepository implements PreferenceRepository {

    private final NotificationPreferencesJpaRepository notificationPreferencesJpaRepository;
    private final NotificationPreferencesMapper notificationPreferencesMapper =
            Mappers.getMapper(NotificationPreferencesMapper.class);

    public JpaPreferenceRepository(NotificationPreferencesJpaRepository notificationPreferencesJpaRepository) {
        this.notificationPreferencesJpaRepository = notificationPreferencesJpaRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<NotificationPreferences> findByUserId(String userId) {
        return notificationPreferencesJpaRepository.findByUserId(userId).map(notificationPreferencesMapper::toDomain);
    }

    @Override
    @Transactional
    public NotificationPreferences save(NotificationPreferences preferences) {
        NotificationPreferencesEntity entity = notificationPreferencesMapper.toEntity(preferences);
        LocalDateTime now = LocalDateTime.now();

        Optional<NotificationPreferencesEntity> existing =
                notificationPreferencesJpaRepository.findByUserId(preferences.getUserId());
        if (existing.isPresent()) {
            entity.setId(existing.get().getId());
            entity.setCreatedAt(existing.get().getCreatedAt());
        } else {
            entity.setCreatedAt(now);
        }
        entity.setUpdatedAt(now);

        return notificationPreferencesMapper.toDomain(notificationPreferencesJpaRepository.save(entity));
    }

    @Override
    @Transactional
    public void deleteByUserId(String userId) {
        notificationPreferencesJpaRepository.deleteByUserId(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<NotificationPreferences> findAll() {
        return notificationPreferencesMapper.toDomainList(notificationPreferencesJpaRepository.findAll());
    }
}
