package com.pharmos.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Predicate;

/**
 * In-process publish/subscribe bus feeding GraphQL subscriptions.
 *
 * Delivery is at-most-once to the subscribers connected at publish time. Nothing
 * is persisted or replayed. Each subscriber gets a bounded buffer; when it is
 * full the configured {@link OverflowPolicy} applies to that subscriber only.
 *
 * The dispatch table is local to this process. Subscribers connected to another
 * instance never see events published here.
 */
@Component
public class EventBus {
    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_BUFFER_SIZE = 256;

    private final Map<Topic, Set<Subscriber<?>>> subscribers = new ConcurrentHashMap<>();
    private final int bufferSize;
    private final OverflowPolicy overflowPolicy;
    private final EventMetrics metrics;

    public EventBus(
            @Value("${pharmos.events.subscriber-buffer:256}") int bufferSize,
            @Value("${pharmos.events.overflow-policy:DROP_OLDEST}") OverflowPolicy overflowPolicy,
            EventMetrics metrics) {
        if (bufferSize < 1) {
            throw new IllegalStateException("pharmos.events.subscriber-buffer must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;
        this.overflowPolicy = overflowPolicy;
        this.metrics = metrics;

        logger.info("EventBus initialized (subscriber buffer={}, overflow policy={})", bufferSize, overflowPolicy);
    }

    /**
     * Offer {@code payload} to every current subscriber of {@code topic}.
     *
     * Returns once the event is handed to each matching subscriber's buffer; it
     * never waits for delivery and never throws because of a subscriber.
     */
    public void publish(Topic topic, Object payload) {
        metrics.recordPublished(topic);
        Set<Subscriber<?>> current = subscribers.getOrDefault(topic, Collections.emptySet());
        logger.debug("Publishing {} to {} subscribers", topic, current.size());

        for (Subscriber<?> subscriber : current) {
            subscriber.offer(topic, payload);
        }
    }

    /**
     * Open a stream of events from {@code topics} whose payload is a
     * {@code payloadType} accepted by {@code filter}.
     *
     * The subscriber is registered when the returned Flux is subscribed and
     * removed when it is cancelled or terminates.
     */
    public <T> Flux<T> subscribe(Class<T> payloadType, Predicate<? super T> filter, Topic... topics) {
        if (topics.length == 0) {
            throw new IllegalArgumentException("At least one topic is required");
        }
        Set<Topic> topicSet = EnumSet.copyOf(Arrays.asList(topics));

        Flux<T> events = Flux.create(sink -> {
            Subscriber<T> subscriber = new Subscriber<>(payloadType, filter, sink, topicSet);
            register(subscriber);
            sink.onDispose(() -> unregister(subscriber));
        }, FluxSink.OverflowStrategy.BUFFER);

        return events.onBackpressureBuffer(bufferSize,
            dropped -> {
                logger.warn("Subscriber buffer full on {}, dropping event", topicSet);
                metrics.recordDropped(topicSet.iterator().next());
            },
            overflowPolicy == OverflowPolicy.DISCONNECT
                ? BufferOverflowStrategy.ERROR
                : BufferOverflowStrategy.DROP_OLDEST);
    }

    /**
     * @return number of live subscribers on {@code topic}
     */
    public int subscriberCount(Topic topic) {
        return subscribers.getOrDefault(topic, Collections.emptySet()).size();
    }

    public int getBufferSize() {
        return bufferSize;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    private void register(Subscriber<?> subscriber) {
        for (Topic topic : subscriber.topics) {
            subscribers.computeIfAbsent(topic, t -> new CopyOnWriteArraySet<>()).add(subscriber);
        }
        logger.debug("Subscriber registered on {}", subscriber.topics);
    }

    private void unregister(Subscriber<?> subscriber) {
        for (Topic topic : subscriber.topics) {
            Set<Subscriber<?>> set = subscribers.get(topic);
            if (set != null) {
                set.remove(subscriber);
            }
        }
        logger.debug("Subscriber removed from {}", subscriber.topics);
    }

    /**
     * One live subscription: its topics, payload type, predicate and sink.
     */
    private final class Subscriber<T> {
        private final Class<T> payloadType;
        private final Predicate<? super T> filter;
        private final FluxSink<T> sink;
        private final Set<Topic> topics;

        Subscriber(Class<T> payloadType, Predicate<? super T> filter, FluxSink<T> sink, Set<Topic> topics) {
            this.payloadType = payloadType;
            this.filter = filter;
            this.sink = sink;
            this.topics = topics;
        }

        void offer(Topic topic, Object payload) {
            if (!payloadType.isInstance(payload)) {
                logger.debug("Skipping {} payload of type {} for subscriber expecting {}",
                    topic, payload == null ? "null" : payload.getClass().getSimpleName(),
                    payloadType.getSimpleName());
                return;
            }
            T event = payloadType.cast(payload);
            boolean accepted;
            try {
                accepted = filter == null || filter.test(event);
            } catch (RuntimeException e) {
                logger.warn("Subscription predicate on {} threw, event skipped for this subscriber: {}",
                    topic, e.toString());
                metrics.recordPredicateFailure(topic);
                return;
            }
            if (accepted) {
                sink.next(event);
                metrics.recordDelivered(topic);
            }
        }
    }
}
