package com.crisisalert.notification.channel;

import com.crisisalert.domain.model.Alert;

/**
 * Local in-app delivery. Synchronous and independent of any external provider,
 * so an alert stays visible in the app when every external channel fails.
 */
public interface InAppSink {

    void publish(Alert alert);
}
