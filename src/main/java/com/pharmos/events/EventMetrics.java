package com.pharmos.events;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Metrics collector for the event bus
 * Tracks published, delivered and dropped events per topic, and predicate failures
 */
@Component
public class EventMetrics {

    private final MeterRegistry meterRegistry;

    public EventMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordPublished(Topic topic) {
        counter("pharmos.events.published", "Events published to the bus", topic).increment();
    }

    public void recordDelivered(Topic topic) {
        counter("pharmos.events.delivered", "Events accepted by a subscriber", topic).increment();
    }

    public void recordDropped(Topic topic) {
        counter("pharmos.events.dropped", "Events discarded by a full subscriber buffer", topic).increment();
    }

    public void recordPredicateFailure(Topic topic) {
        counter("pharmos.events.predicate.failures", "Subscription predicates that threw", topic).increment();
    }

    public double count(String name, Topic topic) {
        Counter counter = meterRegistry.find(name).tag("topic", topic.name()).counter();
        return counter != null ? counter.count() : 0.0;
    }

    private Counter counter(String name, String description, Topic topic) {
        return Counter.builder(name)
            .description(description)
            .tag("topic", topic.name())
            .register(meterRegistry);
    }
}
