package com.z254.butterfly.sentinel.escalation;

import com.z254.butterfly.sentinel.domain.model.EscalationContact;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Default dispatcher when the host wires no channel integration: logs each delivery.
 */
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public DeliveryReport deliver(EscalationNotification notification, List<EscalationContact> targets) {
        for (EscalationContact contact : targets) {
            log.info("Escalation {} step {} -> {} via {} ({}): {}",
                    notification.getEscalationId(), notification.getStep(), contact.getName(),
                    contact.getType(), contact.getAddress(), notification.getSubject());
        }
        return new DeliveryReport(targets.stream().map(EscalationContact::getId).toList(), List.of());
    }
}
