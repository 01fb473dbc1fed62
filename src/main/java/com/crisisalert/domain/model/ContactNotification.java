package com.crisisalert.domain.model;

import com.crisisalert.domain.enums.NotificationChannel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One message sent to an emergency contact by the escalation cascade.
 * Failed attempts are recorded here and never retried.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactNotification {

    private String contactName;
    private int contactPriority;
    private NotificationChannel channel;
    private boolean success;
    private String error;
}
