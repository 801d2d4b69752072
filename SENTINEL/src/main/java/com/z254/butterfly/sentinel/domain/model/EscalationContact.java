package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A person or endpoint that can receive escalation notifications.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationContact {

    private String id;

    private String name;

    private ContactType type;

    /** Channel-specific address: email, phone number, webhook URL... */
    private String address;

    @Builder.Default
    private boolean active = true;
}
