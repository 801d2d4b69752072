package com.z254.butterfly.sentinel.enrichment;

import com.z254.butterfly.sentinel.domain.model.Alert;
import com.z254.butterfly.sentinel.domain.model.EnrichmentRule;

/**
 * A provider of context for alerts, such as a log store, a metrics backend or an internal registry.
 * <p>
 * Implementations are called from the enrichment pool and may block; calls that outlive the
 * enrichment timeout are interrupted.
 */
public interface EnrichmentSource {

    String getId();

    default boolean isEnabled() {
        return true;
    }

    /**
     * @param query the rule's query template with the alert's values filled in, may be null
     */
    SourceLookup lookup(Alert alert, EnrichmentRule rule, String query);
}
