package com.z254.butterfly.sentinel.escalation;

import com.z254.butterfly.sentinel.domain.model.EscalationContact;

import java.util.List;

/**
 * Delivery capability supplied by the host (email, chat, paging...).
 * Implementations must not block for long; slow channels should queue.
 */
public interface NotificationDispatcher {

    DeliveryReport deliver(EscalationNotification notification, List<EscalationContact> targets);
}
