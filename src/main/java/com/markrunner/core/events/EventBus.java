package com.markrunner.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Synchronous fan-out of stage and batch events to in-process listeners.
 * <p>
 * Listeners run on the publishing thread, in subscription order. A listener that throws is
 * logged and skipped; the pipeline never sees the failure.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private record Listener(Predicate<PipelineEvent> filter, Consumer<PipelineEvent> consumer) {}

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    public void publish(PipelineEvent event) {
        log.debug("Event {} [{}] stage={}", event.eventType(), event.runId(), event.stageId());
        for (Listener listener : listeners) {
            if (listener.filter().test(event)) {
                deliverSafely(listener.consumer(), event);
            }
        }
    }

    /**
     * Receives every event.
     */
    public Subscription subscribe(Consumer<PipelineEvent> consumer) {
        return add(new Listener(event -> true, consumer));
    }

    /**
     * Receives only events whose {@link PipelineEvent#eventType()} equals {@code eventType},
     * e.g. {@code failures.classified}.
     */
    public Subscription subscribe(String eventType, Consumer<PipelineEvent> consumer) {
        Objects.requireNonNull(eventType, "eventType");
        return add(new Listener(event -> eventType.equals(event.eventType()), consumer));
    }

    private Subscription add(Listener listener) {
        listeners.add(listener);
        return () -> listeners.removeIf(l -> l == listener);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PipelineEvent> consumer, PipelineEvent event) {
        try {
            consumer.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on event {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
