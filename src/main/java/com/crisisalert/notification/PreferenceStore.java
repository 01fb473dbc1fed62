package com.crisisalert.notification;

import com.crisisalert.domain.model.EmergencyContact;
import com.crisisalert.domain.model.NotificationPreferences;
import com.crisisalert.exception.InvalidPreferencesException;
import com.crisisalert.notification.channel.PushRegistrationService;
import com.crisisalert.repository.PreferenceRepository;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-user delivery preferences.
 *
 * <p>{@link #get} never throws on a missing record. {@link #set} replaces the stored record
 * wholesale, after validating it and ordering the emergency contacts by ascending priority.
 * Writes for the same user are serialised; different users never contend.
 *
 * <p>When a save turns push notifications on (no previous record, or push was off), the
 * user is registered with the {@link PushRegistrationService}. A failed registration is
 * logged and does not undo the save.
 */
@Service
public class PreferenceStore {

    private static final Logger log = LoggerFactory.getLogger(PreferenceStore.class);

    private final PreferenceRepository preferenceRepository;
    private final PushRegistrationService pushRegistrationService;
    private final QuietHoursPolicy quietHoursPolicy;

    private final ConcurrentHashMap<String, ReentrantLock> userLocks = new ConcurrentHashMap<>();

    public PreferenceStore(
            PreferenceRepository preferenceRepository,
            PushRegistrationService pushRegistrationService,
            QuietHoursPolicy quietHoursPolicy) {
        this.preferenceRepository = preferenceRepository;
        this.pushRegistrationService = pushRegistrationService;
        this.quietHoursPolicy = quietHoursPolicy;
    }

    public Optional<NotificationPreferences> get(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return preferenceRepository.findByUserId(userId);
    }

    /**
     * Validates and stores the preferences, replacing any previous record.
     *
     * @throws InvalidPreferencesException on a missing user id, duplicate contact priorities
     *         or malformed quiet-hours times
     */
    public NotificationPreferences set(NotificationPreferences preferences) {
        if (preferences == null || preferences.getUserId() == null || preferences.getUserId().isBlank()) {
            throw new InvalidPreferencesException("Preferences require a userId");
        }
        quietHoursPolicy.validate(preferences.getQuietHours());

        String userId = preferences.getUserId();
        NotificationPreferences normalized = preferences.toBuilder()
                .emergencyContacts(sortedContacts(preferences.getEmergencyContacts()))
                .build();

        NotificationPreferences saved;
        boolean pushNewlyEnabled;

        ReentrantLock lock = userLocks.computeIfAbsent(userId, key -> new ReentrantLock());
        lock.lock();
        try {
            Optional<NotificationPreferences> previous = preferenceRepository.findByUserId(userId);
            pushNewlyEnabled = normalized.isPushNotifications()
                    && previous.map(p -> !p.isPushNotifications()).orElse(true);
            saved = preferenceRepository.save(normalized);
        } finally {
            lock.unlock();
        }

        log.info(
                "Preferences saved: userId={}, push={}, sms={}, email={}, contacts={}",
                userId,
                saved.isPushNotifications(),
                saved.isSmsNotifications(),
                saved.isEmailNotifications(),
                saved.getEmergencyContacts().size());

        if (pushNewlyEnabled) {
            registerPush(userId);
        }
        return saved;
    }

    public void delete(String userId) {
        ReentrantLock lock = userLocks.computeIfAbsent(userId, key -> new ReentrantLock());
        lock.lock();
        try {
            preferenceRepository.deleteByUserId(userId);
        } finally {
            lock.unlock();
        }
        log.info("Preferences deleted: userId={}", userId);
    }

    public List<NotificationPreferences> list() {
        return preferenceRepository.findAll();
    }

    private void registerPush(String userId) {
        try {
            pushRegistrationService.register(userId);
            log.info("Push subscription registered: userId={}", userId);
        } catch (Exception e) {
            log.error("Push subscription failed: userId={}, error={}", userId, e.getMessage());
        }
    }

    private static List<EmergencyContact> sortedContacts(List<EmergencyContact> contacts) {
        if (contacts == null || contacts.isEmpty()) {
            return new ArrayList<>();
        }

        Set<Integer> seen = new HashSet<>();
        for (EmergencyContact contact : contacts) {
            if (!seen.add(contact.getPriority())) {
                throw new InvalidPreferencesException(
                        "Emergency contact priorities must be distinct", Map.of("priority", contact.getPriority()));
            }
        }

        List<EmergencyContact> sorted = new ArrayList<>(contacts);
        sorted.sort(Comparator.comparingInt(EmergencyContact::getPriority));
        return sorted;
    }
}
