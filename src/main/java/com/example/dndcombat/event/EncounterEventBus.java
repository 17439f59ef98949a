package com.example.dndcombat.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delivers encounter events to subscribers on a single dispatcher thread, so listeners
 * never run inside an encounter's write section and see events in commit order.
 */
public class EncounterEventBus {

    private static final Logger logger = LoggerFactory.getLogger(EncounterEventBus.class);

    private final List<EncounterEventListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService dispatcher;

    public EncounterEventBus() {
        this("combat-events");
    }

    public EncounterEventBus(String threadName) {
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    public void subscribe(EncounterEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /** Subscribe to one operation type only. */
    public EncounterEventListener subscribe(OperationType type, EncounterEventListener listener) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(listener, "listener");
        EncounterEventListener filtered = event -> {
            if (event.type() == type) listener.onEvent(event);
        };
        listeners.add(filtered);
        return filtered;
    }

    public boolean unsubscribe(EncounterEventListener listener) {
        return listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    /**
     * Queue an event for delivery. Returns immediately.
     */
    public void publish(EncounterEvent event) {
        Objects.requireNonNull(event, "event");
        if (dispatcher.isShutdown()) {
            logger.warn("[EncounterEventBus] Dropping {} for encounter {}: dispatcher shut down",
                event.type(), event.encounterId());
            return;
        }
        dispatcher.execute(() -> deliver(event));
    }

    private void deliver(EncounterEvent event) {
        for (EncounterEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                // one broken listener must not starve the rest
                logger.error("[EncounterEventBus] Listener {} failed on {} #{} for encounter {}",
                    listener, event.type(), event.sequence(), event.encounterId(), e);
            }
        }
    }

    /**
     * Block until every event published before this call has been delivered.
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        Future<?> marker = dispatcher.submit(() -> { });
        try {
            marker.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Dispatcher marker failed", e.getCause());
        }
    }

    public void shutdown() {
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(2, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
