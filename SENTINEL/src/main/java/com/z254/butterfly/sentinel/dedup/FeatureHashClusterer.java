package com.z254.butterfly.sentinel.dedup;

import com.z254.butterfly.sentinel.domain.model.Alert;

/**
 * Deterministic bucketer over a few numeric alert features.
 */
public class FeatureHashClusterer implements AlertClusterer {

    static final int BUCKETS = 10;

    @Override
    public String clusterOf(Alert alert) {
        long[] features = {
                alert.getSeverity() != null ? alert.getSeverity().level() : 0,
                alert.getMessage() != null ? alert.getMessage().length() : 0,
                alert.getSource() != null ? alert.getSource().length() : 0,
                alert.getTags() != null ? alert.getTags().size() : 0
        };
        long sum = 0;
        for (long feature : features) {
            sum += feature * 31;
        }
        return "cluster_" + Math.floorMod(sum, BUCKETS);
    }
}
