package com.alertengine.core.bus;

import com.alertengine.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process publisher for engine events. Handlers run on the publishing thread; a
 * failing handler is reported to the error callback and never stops delivery to the rest.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Consumer<? extends Event>>> typedHandlers =
            new ConcurrentHashMap<>();
    private final List<Consumer<Event>> anyHandlers = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Event handler failed for " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> Subscription subscribe(Class<T> type, Consumer<T> handler) {
        List<Consumer<? extends Event>> handlers =
                typedHandlers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>());
        handlers.add(handler);
        return () -> handlers.remove(handler);
    }

    public Subscription subscribeAll(Consumer<Event> handler) {
        anyHandlers.add(handler);
        return () -> anyHandlers.remove(handler);
    }

    public void publish(Event event) {
        for (Consumer<? extends Event> handler : typedHandlers.getOrDefault(event.getClass(), List.of())) {
            deliver(handler, event);
        }
        for (Consumer<Event> handler : anyHandlers) {
            deliver(handler, event);
        }
    }

    @SuppressWarnings("unchecked")
    private void deliver(Consumer<? extends Event> handler, Event event) {
        try {
            ((Consumer<Event>) handler).accept(event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }

    @FunctionalInterface
    public interface Subscription {
        void cancel();
    }
}
