package com.crisisalert.config;

import java.time.Duration;
import java.time.ZoneId;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings for the alert delivery engine.
 *
 * <p>Reads from application.yml:
 * <pre>
 * crisisalert.notifications.zone-id=Europe/London
 * crisisalert.notifications.channel-timeout=10s
 * crisisalert.notifications.max-emergency-contacts=3
 * crisisalert.notifications.crisis-hotline=988
 * crisisalert.notifications.platform-name=Astral
 * crisisalert.notifications.preference-store=jpa
 * crisisalert.notifications.gateway.enabled=false
 * crisisalert.notifications.gateway.base-url=${DELIVERY_GATEWAY_URL:}
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "crisisalert.notifications")
public class NotificationProperties {

    /** Zone used for quiet hours when the user has no timezone of their own. Blank = system zone. */
    private String zoneId;

    private Duration channelTimeout = Duration.ofSeconds(10);
    private int maxEmergencyContacts = 3;
    private String crisisHotline = "988";
    private String platformName = "Astral";

    /** {@code jpa} or {@code memory}. */
    private String preferenceStore = "jpa";

    private Gateway gateway = new Gateway();

    public ZoneId resolveZone() {
        return zoneId == null || zoneId.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zoneId);
    }

    /** External delivery gateway that fronts the push, SMS and email providers. */
    @Data
    public static class Gateway {

        private boolean enabled = false;
        private String baseUrl;
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(5);
    }
}
