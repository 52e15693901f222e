package com.pipewright.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Process-local pub/sub for the events of runs driven by this process.
 * <p>
 * Per-run subscribers are dropped once an event ends the run for this process
 * (see {@link PipelineEvent#endsRun()}); a chained step process has its own bus
 * and its own subscribers. Global subscribers stay until they unsubscribe.
 * A failing subscriber never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<PipelineEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<PipelineEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(PipelineEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());

        List<Consumer<PipelineEvent>> runSubs = runSubscribers.get(event.runId());
        if (runSubs != null) {
            for (Consumer<PipelineEvent> subscriber : runSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<PipelineEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }

        if (event.endsRun() && runSubs != null) {
            runSubscribers.remove(event.runId(), runSubs);
            log.debug("Dropped {} subscriber(s) of run {} after {}", runSubs.size(), event.runId(), event.eventType());
        }
    }

    /**
     * Subscribe to events for a specific run.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<PipelineEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            runSubscribers.computeIfPresent(runId, (id, subs) -> {
                subs.remove(consumer);
                return subs.isEmpty() ? null : subs;
            });
        };
    }

    public int subscriberCount(String runId) {
        List<Consumer<PipelineEvent>> subs = runSubscribers.get(runId);
        return subs != null ? subs.size() : 0;
    }

    public Subscription subscribeAll(Consumer<PipelineEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PipelineEvent> subscriber, PipelineEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
