package com.z254.butterfly.sentinel.enrichment;

import com.z254.butterfly.sentinel.domain.model.EnrichmentType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class EnrichmentStats {

    long totalEnrichments;

    Map<EnrichmentType, Long> enrichmentsByType;

    Map<String, Long> enrichmentsBySource;

    double averageEnrichmentMillis;

    /** Fraction of lookups served from cache, in [0,1] */
    double cacheHitRate;

    /** Fraction of enrichments with at least one failed lookup, in [0,1] */
    double errorRate;

    long cachedEntries;
}
