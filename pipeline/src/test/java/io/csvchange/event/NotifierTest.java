package io.csvchange.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NotifierTest {

    @Test
    void throwing_subscriber_does_not_stop_delivery() {
        Notifier<String> n = new Notifier<>("test");
        List<String> got = new ArrayList<>();
        n.subscribe(s -> {
            throw new IllegalStateException("bad subscriber");
        });
        n.subscribe(got::add);

        n.publish("a");

        assertEquals(List.of("a"), got);
    }

    @Test
    void closing_the_handle_unsubscribes() throws Exception {
        Notifier<String> n = new Notifier<>("test");
        List<String> got = new ArrayList<>();
        AutoCloseable handle = n.subscribe(got::add);
        n.publish("a");
        handle.close();
        n.publish("b");

        assertEquals(List.of("a"), got);
        assertEquals(0, n.subscriberCount());
    }
}
