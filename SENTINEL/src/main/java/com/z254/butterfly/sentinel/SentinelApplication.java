package com.z254.butterfly.sentinel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * SENTINEL - Alert Processing Core for the BUTTERFLY Ecosystem.
 *
 * <p>SENTINEL provides:
 * <ul>
 *   <li>Deduplication - Fingerprinting, fuzzy similarity and time-windowed grouping</li>
 *   <li>Business Impact Scoring - Weighted 1-100 importance per alert</li>
 *   <li>Suppression - Priority-ranked rules and maintenance windows</li>
 *   <li>Enrichment - Related alerts and service context from pluggable sources</li>
 *   <li>Escalation - Timed, schedule-aware notification policies</li>
 *   <li>Analytics - Event log, MTTR/MTTA, pattern detection and export</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class SentinelApplication {

    public static void main(String[] args) {
        SpringApplication.run(SentinelApplication.class, args);
    }
}
