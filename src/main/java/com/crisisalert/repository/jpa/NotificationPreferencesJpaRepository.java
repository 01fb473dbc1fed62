package com.crisisalert.repository.jpa;

import com.crisisalert.entity.NotificationPreferencesEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Spring Data repository for the notification_preferences table. */
@Repository
public interface NotificationPreferencesJpaRepository extends JpaRepository<NotificationPreferencesEntity, Long> {

    Optional<NotificationPreferencesEntity> findByUserId(String userId);

    long deleteByUserId(String userId);
}
