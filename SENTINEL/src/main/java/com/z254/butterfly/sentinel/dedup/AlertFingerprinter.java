package com.z254.butterfly.sentinel.dedup;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.Alert;
import com.z254.butterfly.sentinel.domain.model.Severity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Computes grouping keys and pairwise similarity for alerts.
 * <p>
 * Both operations are pure: no randomness and no machine-local state, so fingerprints are
 * stable across restarts.
 */
@Component
public class AlertFingerprinter {

    private static final Pattern UUID = Pattern.compile(
            "\\b[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}\\b");
    private static final Pattern EMAIL = Pattern.compile("[\\w.+-]+@[\\w-]+(?:\\.[\\w-]+)+");
    private static final Pattern IPV4 = Pattern.compile("\\b(?:[0-9]{1,3}\\.){3}[0-9]{1,3}\\b");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final double SOURCE_WEIGHT = 0.3;
    static final double SEVERITY_WEIGHT = 0.2;
    static final double MESSAGE_WEIGHT = 0.4;
    static final double TAGS_WEIGHT = 0.1;

    private final List<String> defaultFields;

    @Autowired
    public AlertFingerprinter(SentinelProperties properties) {
        this(properties.getDeduplication().getFingerprintFields());
    }

    public AlertFingerprinter(List<String> defaultFields) {
        this.defaultFields = List.copyOf(defaultFields);
    }

    public String fingerprint(Alert alert) {
        return fingerprint(alert, defaultFields);
    }

    /**
     * Hash over the given fields. Field order does not matter.
     * Unknown field names are looked up in the alert metadata.
     */
    public String fingerprint(Alert alert, Collection<String> fields) {
        TreeMap<String, String> values = new TreeMap<>();
        for (String field : fields) {
            values.put(field, fieldValue(alert, field));
        }
        StringBuilder canonical = new StringBuilder();
        values.forEach((field, value) -> canonical.append(field).append('=').append(value).append('\n'));
        return sha256(canonical.toString());
    }

    /**
     * Replace volatile values with placeholders: UUIDs, emails, IPv4 addresses, digit runs.
     */
    public String normalizeMessage(String message) {
        if (message == null) {
            return "";
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        normalized = UUID.matcher(normalized).replaceAll("<uuid>");
        normalized = EMAIL.matcher(normalized).replaceAll("<email>");
        normalized = IPV4.matcher(normalized).replaceAll("<ip>");
        normalized = DIGITS.matcher(normalized).replaceAll("<n>");
        return WHITESPACE.matcher(normalized).replaceAll(" ").trim();
    }

    /**
     * Weighted similarity in [0,1]. Tags only count when both alerts carry tags; the result is
     * divided by the weight actually applied.
     */
    public double similarity(Alert a, Alert b) {
        double score = 0.0;
        double appliedWeight = 0.0;

        score += SOURCE_WEIGHT * (Objects.equals(a.getSource(), b.getSource()) ? 1.0 : 0.0);
        appliedWeight += SOURCE_WEIGHT;

        score += SEVERITY_WEIGHT * severityCloseness(a.getSeverity(), b.getSeverity());
        appliedWeight += SEVERITY_WEIGHT;

        score += MESSAGE_WEIGHT * levenshteinRatio(normalizeMessage(a.getMessage()), normalizeMessage(b.getMessage()));
        appliedWeight += MESSAGE_WEIGHT;

        if (a.hasTags() && b.hasTags()) {
            score += TAGS_WEIGHT * jaccard(a.getTags(), b.getTags());
            appliedWeight += TAGS_WEIGHT;
        }
        return score / appliedWeight;
    }

    static double severityCloseness(Severity a, Severity b) {
        if (a == null || b == null) {
            return a == b ? 1.0 : 0.0;
        }
        int span = Severity.CRITICAL.level() - Severity.LOW.level();
        return 1.0 - (double) Math.abs(a.level() - b.level()) / span;
    }

    static double levenshteinRatio(String a, String b) {
        int maxLen = Math.max(a.length(), b.length());
        if (maxLen == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / maxLen;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    static double jaccard(Set<String> a, Set<String> b) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return (double) intersection.size() / union.size();
    }

    // ========== Private Methods ==========

    private String fieldValue(Alert alert, String field) {
        return switch (field) {
            case "source" -> String.valueOf(alert.getSource());
            case "severity" -> alert.getSeverity() != null ? alert.getSeverity().name().toLowerCase(Locale.ROOT) : "";
            case "message" -> normalizeMessage(alert.getMessage());
            case "tags" -> alert.hasTags() ? String.join(",", new TreeSet<>(alert.getTags())) : "";
            default -> {
                Object value = alert.getMetadata() != null ? alert.getMetadata().get(field) : null;
                yield value != null ? value.toString() : "";
            }
        };
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
