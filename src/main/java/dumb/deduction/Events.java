package dumb.deduction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

public class Events {

    private static final Logger logger = LoggerFactory.getLogger(Events.class);

    public final ExecutorService exe;
    final ConcurrentMap<Class<? extends Event>, CopyOnWriteArrayList<Consumer<Event>>> listeners = new ConcurrentHashMap<>();

    public Events(ExecutorService exe) {
        this.exe = requireNonNull(exe);
    }

    private static void exeSafe(Consumer<Event> listener, Event event) {
        try {
            listener.accept(event);
        } catch (Exception e) {
            logger.error("Error in listener for {}", event.getEventType(), e);
        }
    }

    public <T extends Event> void on(Class<T> eventType, Consumer<T> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(event -> listener.accept(eventType.cast(event)));
    }

    public void emit(Event event) {
        if (exe.isShutdown()) {
            logger.debug("Dropping {} after shutdown", event.getEventType());
            return;
        }
        try {
            exe.submit(() -> listeners.getOrDefault(event.getClass(), new CopyOnWriteArrayList<>())
                    .forEach(listener -> exeSafe(listener, event)));
        } catch (RejectedExecutionException e) {
            logger.debug("Dropping {}: executor rejected it", event.getEventType());
        }
    }
}
