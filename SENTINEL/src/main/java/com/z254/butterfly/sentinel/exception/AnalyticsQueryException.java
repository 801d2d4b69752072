package com.z254.butterfly.sentinel.exception;

import com.z254.butterfly.sentinel.analytics.AnalyticsQuery;

/**
 * Malformed analytics query. Carries the query as submitted.
 */
public class AnalyticsQueryException extends SentinelException {

    private final transient AnalyticsQuery query;

    public AnalyticsQueryException(String message, AnalyticsQuery query) {
        super(message + " [query=" + query + "]");
        this.query = query;
    }

    public AnalyticsQuery getQuery() {
        return query;
    }
}
