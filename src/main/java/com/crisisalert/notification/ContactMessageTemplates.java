package com.crisisalert.notification;

import com.crisisalert.config.NotificationProperties;
import com.crisisalert.domain.model.Alert;
import com.crisisalert.domain.model.NotificationPreferences;
import org.springframework.stereotype.Component;

/**
 * Message texts for SMS and email.
 *
 * <p>Emergency contacts get a generic "check on your loved one" message that names the
 * platform and the crisis hotline. The alert's own title and message never reach a contact.
 */
@Component
public class ContactMessageTemplates {

    static final String CONTACT_SUBJECT = "CRISIS ALERT - Please Check on Your Loved One";

    private static final String CONTACT_BODY = "CRISIS ALERT: %s may need immediate support. "
            + "They are using the %s mental health platform and a crisis situation has been detected. "
            + "Please reach out to them or call %s if needed.";

    private static final String UNNAMED_USER = "Someone you care about";

    private final NotificationProperties notificationProperties;

    public ContactMessageTemplates(NotificationProperties notificationProperties) {
        this.notificationProperties = notificationProperties;
    }

    public String contactSubject() {
        return CONTACT_SUBJECT;
    }

    /** Uses the display name, never the raw user id. */
    public String contactBody(NotificationPreferences preferences) {
        String name = preferences.getDisplayName() != null && !preferences.getDisplayName().isBlank()
                ? preferences.getDisplayName()
                : UNNAMED_USER;
        return String.format(
                CONTACT_BODY, name, notificationProperties.getPlatformName(), notificationProperties.getCrisisHotline());
    }

    public String contactSms(NotificationPreferences preferences) {
        return CONTACT_SUBJECT + ": " + contactBody(preferences);
    }

    public String userSms(Alert alert) {
        return alert.getTitle() + ": " + alert.getMessage();
    }
}
