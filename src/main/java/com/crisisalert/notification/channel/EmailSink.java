package com.crisisalert.notification.channel;

import com.crisisalert.domain.model.AlertAction;
import java.util.List;

public interface EmailSink {

    /** @return true when the provider accepted the message */
    boolean send(String address, String subject, String body, List<AlertAction> actions);
}
