package com.crisisalert.notification.channel;

/** Platform push delivery (web push, mobile push gateway). */
public interface PushSink {

    /**
     * @return true when the platform accepted the notification
     * @throws com.crisisalert.exception.ChannelUnavailableException if push is not configured for the user
     */
    boolean send(String userId, String title, String body, PushOptions options);
}
