package com.qualsim.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers simulation progress events to listeners.
 * <p>
 * A listener follows one run, optionally restricted to some event types, or every run.
 * Listeners of a run are dropped once its {@link SimulationEvent.Type#SIMULATION_COMPLETED}
 * event has been delivered. A failing listener is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private record Listener(Set<SimulationEvent.Type> types, Consumer<SimulationEvent> consumer) {

        boolean accepts(SimulationEvent event) {
            return types.contains(event.type());
        }
    }

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Listener>> runListeners = new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Listener> globalListeners = new CopyOnWriteArrayList<>();

    public void publish(SimulationEvent event) {
        log.debug("Event {} for {}", event.eventType(), event.simulationId());

        List<Listener> listeners = event.type().isFinal()
                ? runListeners.remove(event.simulationId())
                : runListeners.get(event.simulationId());
        if (listeners != null) {
            listeners.forEach(listener -> deliver(listener, event));
        }
        globalListeners.forEach(listener -> deliver(listener, event));
    }

    public Subscription subscribe(String simulationId, Consumer<SimulationEvent> consumer) {
        return subscribe(simulationId, EnumSet.allOf(SimulationEvent.Type.class), consumer);
    }

    /**
     * @param simulationId the run to follow; it need not have started yet
     * @param types        event types to receive
     * @param consumer     callback invoked on the publishing thread
     * @return a handle that removes the listener
     */
    public Subscription subscribe(String simulationId, Set<SimulationEvent.Type> types,
                                  Consumer<SimulationEvent> consumer) {
        Listener listener = new Listener(EnumSet.copyOf(types), consumer);
        runListeners.computeIfAbsent(simulationId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> runListeners.computeIfPresent(simulationId, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public Subscription subscribeAll(Consumer<SimulationEvent> consumer) {
        Listener listener = new Listener(EnumSet.allOf(SimulationEvent.Type.class), consumer);
        globalListeners.add(listener);
        return () -> globalListeners.remove(listener);
    }

    /** Number of runs that currently have listeners. */
    public int followedRuns() {
        return runListeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(Listener listener, SimulationEvent event) {
        if (!listener.accepts(event)) {
            return;
        }
        try {
            listener.consumer().accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for {}: {}", event.eventType(), event.simulationId(), e.getMessage(), e);
        }
    }
}
