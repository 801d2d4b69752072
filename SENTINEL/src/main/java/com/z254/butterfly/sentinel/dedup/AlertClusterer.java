package com.z254.butterfly.sentinel.dedup;

import com.z254.butterfly.sentinel.domain.model.Alert;

/**
 * Assigns alerts to coarse clusters so that fuzzy matching only compares likely candidates.
 * <p>
 * Implementations may call out to a model service. The deduplication engine bounds each call
 * with a timeout and falls back to rule-based matching when a call fails or times out.
 */
public interface AlertClusterer {

    /**
     * @return a cluster identifier, never null
     */
    String clusterOf(Alert alert);
}
