package com.crisisalert.domain.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Person notified during a crisis. Lower {@code priority} values are contacted first;
 * priorities are unique per user.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EmergencyContact {

    @NotBlank
    private String name;

    private String phone;
    private String email;
    private String relationship;
    private int priority;
}
