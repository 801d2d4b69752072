package com.z254.butterfly.sentinel.domain.model;

public enum ContactType {
    EMAIL,
    SMS,
    PHONE,
    SLACK,
    DISCORD,
    WEBHOOK,
    PAGERDUTY
}
