package com.z254.butterfly.sentinel.event;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.EnumSet;
import java.util.Set;

/**
 * Publishes lifecycle notifications to subscribers.
 * <p>
 * Subscribers only see events emitted after they subscribe. Publishing never blocks and never
 * fails the caller: events without subscribers, or for slow subscribers, are dropped.
 */
@Slf4j
@Component
public class SentinelEventBus {

    private final Sinks.Many<SentinelEvent> sink = Sinks.many().multicast().directBestEffort();

    /**
     * Publish an event. Emission is serialized so concurrent engines can publish safely.
     */
    public synchronized void publish(SentinelEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            return;
        }
        if (result.isFailure()) {
            log.warn("Failed to publish event: {} ({}) - {}", event.getType(), event.getSubjectId(), result);
        } else {
            log.debug("Published event: {} ({})", event.getType(), event.getSubjectId());
        }
    }

    /**
     * Subscribe to every event.
     */
    public Flux<SentinelEvent> subscribe() {
        return sink.asFlux();
    }

    /**
     * Subscribe to the given event types only.
     */
    public Flux<SentinelEvent> subscribe(Set<SentinelEventType> types) {
        Set<SentinelEventType> wanted = types.isEmpty()
                ? EnumSet.allOf(SentinelEventType.class)
                : EnumSet.copyOf(types);
        return sink.asFlux().filter(event -> wanted.contains(event.getType()));
    }

    public int subscriberCount() {
        return sink.currentSubscriberCount();
    }

    @PreDestroy
    public synchronized void shutdown() {
        sink.tryEmitComplete();
        log.info("Event bus closed");
    }
}
