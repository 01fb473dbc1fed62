package com.crisisalert.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the notification_preferences table, one row per user.
 * Quiet hours are flattened into three columns; emergency contacts are stored as a JSON array.
 */
@Entity
@Table(name = "notification_preferences")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotificationPreferencesEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", length = 64, nullable = false, unique = true)
    private String userId;

    @Column(name = "display_name", length = 100)
    private String displayName;

    @Column(name = "push_notifications")
    private boolean pushNotifications;

    @Column(name = "sms_notifications")
    private boolean smsNotifications;

    @Column(name = "email_notifications")
    private boolean emailNotifications;

    @Column(name = "crisis_alerts")
    private boolean crisisAlerts;

    @Column(name = "reminder_alerts")
    private boolean reminderAlerts;

    @Column(name = "mood_check_ins")
    private boolean moodCheckIns;

    @Column(name = "therapy_reminders")
    private boolean therapyReminders;

    @Column(name = "support_group_notifications")
    private boolean supportGroupNotifications;

    @Column(name = "emergency_contact_alerts")
    private boolean emergencyContactAlerts;

    /** HH:mm */
    @Column(name = "quiet_hours_start", length = 5)
    private String quietHoursStart;

    /** HH:mm */
    @Column(name = "quiet_hours_end", length = 5)
    private String quietHoursEnd;

    @Column(name = "quiet_hours_enabled")
    private boolean quietHoursEnabled;

    @Column(name = "phone_number", length = 32)
    private String phoneNumber;

    @Column(length = 254)
    private String email;

    @Column(length = 64)
    private String timezone;

    /** JSON array of emergency contacts, ordered by priority. */
    @Lob
    @Column(name = "emergency_contacts")
    private String emergencyContacts;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
