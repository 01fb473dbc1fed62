package com.crisisalert.notification.channel;

public interface SmsSink {

    /** @return true when the provider accepted the message */
    boolean send(String phoneNumber, String message);
}
