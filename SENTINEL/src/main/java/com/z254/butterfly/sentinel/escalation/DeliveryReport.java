package com.z254.butterfly.sentinel.escalation;

import lombok.Value;

import java.util.List;

@Value
public class DeliveryReport {

    List<String> deliveredContactIds;

    List<String> failedContactIds;

    public static DeliveryReport allFailed(List<String> contactIds) {
        return new DeliveryReport(List.of(), List.copyOf(contactIds));
    }
}
