package com.z254.butterfly.sentinel.enrichment;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * All context gathered for one alert. Failed lookups are listed in {@link #errors} and do not
 * prevent the others from completing.
 */
@Value
@Builder
public class EnrichmentResult {

    String alertId;

    @Singular("enrichment")
    List<EnrichedData> enrichedData;

    Duration processingTime;

    int cacheHits;

    int cacheMisses;

    @Singular
    List<EnrichmentError> errors;

    public boolean hasData() {
        return !enrichedData.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
