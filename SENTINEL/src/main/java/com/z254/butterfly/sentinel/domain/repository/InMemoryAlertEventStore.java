package com.z254.butterfly.sentinel.domain.repository;

import com.z254.butterfly.sentinel.domain.model.AlertEvent;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lock-free in-memory event log. Readers work on snapshots, so retention pruning never blocks
 * appends.
 */
@Repository
public class InMemoryAlertEventStore implements AlertEventStore {

    private final ConcurrentLinkedQueue<AlertEvent> events = new ConcurrentLinkedQueue<>();
    private final AtomicInteger size = new AtomicInteger();

    @Override
    public void append(AlertEvent event) {
        events.add(event);
        size.incrementAndGet();
    }

    @Override
    public List<AlertEvent> findAll() {
        return new ArrayList<>(events);
    }

    @Override
    public List<AlertEvent> findSince(Instant from) {
        List<AlertEvent> result = new ArrayList<>();
        for (AlertEvent event : events) {
            if (!event.getTimestamp().isBefore(from)) {
                result.add(event);
            }
        }
        return result;
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        int removed = 0;
        Iterator<AlertEvent> iterator = events.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getTimestamp().isBefore(cutoff)) {
                iterator.remove();
                removed++;
            }
        }
        size.addAndGet(-removed);
        return removed;
    }

    @Override
    public int size() {
        return size.get();
    }
}
