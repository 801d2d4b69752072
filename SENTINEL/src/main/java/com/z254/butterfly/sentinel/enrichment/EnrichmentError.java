package com.z254.butterfly.sentinel.enrichment;

import lombok.Value;

import java.time.Instant;

@Value
public class EnrichmentError {

    String ruleId;

    String sourceId;

    String error;

    Instant timestamp;
}
