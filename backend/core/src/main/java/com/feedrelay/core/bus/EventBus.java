package com.feedrelay.core.bus;

import com.feedrelay.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process publish/subscribe. Handlers run on the publishing thread, so a
 * polling worker that publishes {@code ItemRelayed} pays for its subscribers; keep them cheap.
 * A failing handler is reported to the error callback and never reaches the publisher.
 *
 * <p>Typed handlers see events of exactly their type; {@link #subscribeAll} handlers see every event,
 * after the typed ones.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, CopyOnWriteArrayList<Consumer<? extends Event>>> typedHandlers =
            new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<Event>> catchAllHandlers = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Event handler failed for type " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> Registration subscribe(Class<T> type, Consumer<T> handler) {
        CopyOnWriteArrayList<Consumer<? extends Event>> handlers =
                typedHandlers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>());
        // Wrap so that registering the same lambda twice yields two independently removable entries.
        Consumer<T> entry = handler::accept;
        handlers.add(entry);
        return () -> handlers.remove(entry);
    }

    public Registration subscribeAll(Consumer<Event> handler) {
        Consumer<Event> entry = handler::accept;
        catchAllHandlers.add(entry);
        return () -> catchAllHandlers.remove(entry);
    }

    public int handlerCount(Class<? extends Event> type) {
        List<Consumer<? extends Event>> handlers = typedHandlers.get(type);
        return (handlers == null ? 0 : handlers.size()) + catchAllHandlers.size();
    }

    public void publish(Event event) {
        List<Consumer<? extends Event>> handlers = typedHandlers.get(event.getClass());
        if (handlers != null) {
            for (Consumer<? extends Event> rawHandler : handlers) {
                invokeHandler(rawHandler, event, onHandlerError);
            }
        }
        for (Consumer<Event> handler : catchAllHandlers) {
            invokeHandler(handler, event, onHandlerError);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T extends Event> void invokeHandler(
            Consumer<? extends Event> rawHandler,
            Event event,
            BiConsumer<Event, Exception> onHandlerError
    ) {
        try {
            Consumer<T> typedHandler = (Consumer<T>) rawHandler;
            typedHandler.accept((T) event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }

    /**
     * Handle for removing a handler. Closing twice is harmless.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
