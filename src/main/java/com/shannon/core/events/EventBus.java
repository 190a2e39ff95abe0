package com.shannon.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers session progress events to the listeners of that session.
 * <p>
 * Wave members and parallel agents publish from worker threads while the CLI listens on another, so listener
 * lists are copy-on-write and a listener that throws never fails the agent that published. A session's entry
 * is dropped once its last listener unsubscribes.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ShannonEvent>>> listeners =
            new ConcurrentHashMap<>();

    public void publish(ShannonEvent event) {
        if (event.sessionId() == null) {
            log.debug("Dropping {}: no session", event.eventType());
            return;
        }
        List<Consumer<ShannonEvent>> sessionListeners = listeners.get(event.sessionId());
        if (sessionListeners == null) {
            return;
        }
        log.debug("Publishing {} for session {}", event.eventType(), event.sessionId());
        for (Consumer<ShannonEvent> listener : sessionListeners) {
            deliverSafely(listener, event);
        }
    }

    /**
     * Listen to the events of one session.
     *
     * @return a handle that removes the listener
     */
    public Subscription subscribe(String sessionId, Consumer<ShannonEvent> listener) {
        listeners.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> listeners.computeIfPresent(sessionId, (k, current) -> {
            current.remove(listener);
            return current.isEmpty() ? null : current;
        });
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ShannonEvent> listener, ShannonEvent event) {
        try {
            listener.accept(event);
        } catch (Exception e) {
            log.warn("Listener failed on {} for session {}: {}", event.eventType(), event.sessionId(),
                    e.getMessage(), e);
        }
    }
}
