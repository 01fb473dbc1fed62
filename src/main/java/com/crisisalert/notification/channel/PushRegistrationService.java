package com.crisisalert.notification.channel;

/** Exchanges a push subscription for a user whose push notifications were just enabled. */
public interface PushRegistrationService {

    void register(String userId);
}
