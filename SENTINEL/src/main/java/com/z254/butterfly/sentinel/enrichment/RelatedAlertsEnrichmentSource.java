package com.z254.butterfly.sentinel.enrichment;

import com.z254.butterfly.sentinel.dedup.AlertDeduplicationEngine;
import com.z254.butterfly.sentinel.dedup.AlertFingerprinter;
import com.z254.butterfly.sentinel.domain.model.Alert;
import com.z254.butterfly.sentinel.domain.model.AlertGroup;
import com.z254.butterfly.sentinel.domain.model.EnrichmentRule;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Related alerts from the live deduplication groups: other groups seen inside the rule's window
 * that share the alert's source or resemble it.
 */
@Component
public class RelatedAlertsEnrichmentSource implements EnrichmentSource {

    public static final String ID = "related-alerts";

    static final double MIN_CORRELATION = 0.5;

    private final AlertDeduplicationEngine deduplicationEngine;
    private final AlertFingerprinter fingerprinter;

    public RelatedAlertsEnrichmentSource(AlertDeduplicationEngine deduplicationEngine,
                                         AlertFingerprinter fingerprinter) {
        this.deduplicationEngine = deduplicationEngine;
        this.fingerprinter = fingerprinter;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public SourceLookup lookup(Alert alert, EnrichmentRule rule, String query) {
        Instant from = alert.getTimestamp().minus(rule.getTimeWindow());
        int groupSize = 0;
        List<Map<String, Object>> related = new ArrayList<>();

        for (AlertGroup group : deduplicationEngine.getGroups()) {
            Alert representative;
            Instant lastSeen;
            int count;
            synchronized (group) {
                representative = group.getRepresentative();
                lastSeen = group.getLastSeen();
                count = group.getCount();
            }
            if (group.getId().equals(alert.getGroupId())) {
                groupSize = count;
                continue;
            }
            if (lastSeen.isBefore(from)) {
                continue;
            }
            double correlation = fingerprinter.similarity(alert, representative);
            boolean sameSource = Objects.equals(alert.getSource(), representative.getSource());
            if (!sameSource && correlation < MIN_CORRELATION) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("groupId", group.getId());
            entry.put("alertId", representative.getId());
            entry.put("source", representative.getSource());
            entry.put("severity", representative.getSeverity().name());
            entry.put("message", representative.getMessage());
            entry.put("lastSeen", lastSeen.toString());
            entry.put("count", count);
            entry.put("correlation", correlation);
            related.add(entry);
        }

        related.sort(Comparator.comparing((Map<String, Object> entry) -> (Double) entry.get("correlation")).reversed());
        if (related.size() > rule.getMaxResults()) {
            related = new ArrayList<>(related.subList(0, rule.getMaxResults()));
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("groupId", alert.getGroupId());
        data.put("groupSize", groupSize);
        data.put("relatedAlerts", related);
        return SourceLookup.builder()
                .data(data)
                .resultCount(related.size())
                .summary("Found " + related.size() + " related alert groups in the last "
                        + rule.getTimeWindow().toMinutes() + " minutes")
                .build();
    }
}
