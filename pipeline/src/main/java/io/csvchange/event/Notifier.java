package io.csvchange.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous publish/subscribe. A throwing subscriber is logged and skipped; the remaining subscribers still run.
 */
public class Notifier<E> {
    private static final Logger log = LoggerFactory.getLogger(Notifier.class);

    private final String name;
    private final List<Consumer<? super E>> subscribers = new CopyOnWriteArrayList<>();

    public Notifier(String name) { this.name = name; }

    /** Returns a handle that removes the subscription when closed. */
    public AutoCloseable subscribe(Consumer<? super E> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    public void publish(E event) {
        for (Consumer<? super E> s : subscribers) {
            try {
                s.accept(event);
            } catch (RuntimeException e) {
                log.warn("Subscriber on '{}' failed for {}: {}", name, event, e.toString());
            }
        }
    }

    public int subscriberCount() { return subscribers.size(); }
}
