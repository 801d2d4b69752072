package com.z254.butterfly.sentinel.domain.repository;

import com.z254.butterfly.sentinel.domain.model.AlertEvent;

import java.time.Instant;
import java.util.List;

/**
 * Append-only alert event log.
 */
public interface AlertEventStore {

    void append(AlertEvent event);

    /**
     * Snapshot of all retained events in insertion order.
     */
    List<AlertEvent> findAll();

    /**
     * Events with {@code timestamp >= from}, in insertion order.
     */
    List<AlertEvent> findSince(Instant from);

    /**
     * Remove events older than the cutoff.
     *
     * @return number of removed events
     */
    int deleteOlderThan(Instant cutoff);

    int size();
}
