package com.z254.butterfly.sentinel.dedup;

import com.z254.butterfly.sentinel.domain.model.Alert;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of {@link AlertDeduplicationEngine#process(Alert)}.
 */
@Value
@Builder
public class DeduplicationResult {

    /** True when the alert started a new group */
    boolean isNew;

    String groupId;

    boolean suppressed;

    /** Up to ten earliest members of the group */
    List<Alert> similarAlerts;

    /** How the group was found */
    MatchType matchType;

    public enum MatchType {
        NEW_GROUP,
        EXACT,
        CLUSTER,
        SIMILARITY
    }
}
