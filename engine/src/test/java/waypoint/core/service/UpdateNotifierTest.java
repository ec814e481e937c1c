package waypoint.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("UpdateNotifier")
class UpdateNotifierTest {

    private final UpdateNotifier notifier = new UpdateNotifier();

    @Test
    @DisplayName("Should deliver updates to every subscriber of a key")
    void shouldDeliverToSubscribers() {
        List<Object> first = new ArrayList<>();
        List<Object> second = new ArrayList<>();
        notifier.subscribe("page:/a", first::add);
        notifier.subscribe("page:/a", second::add);
        notifier.subscribe("page:/b", data -> first.add("wrong key"));

        int delivered = notifier.notifySubscribers("page:/a", "fresh");

        assertEquals(2, delivered);
        assertEquals(List.of("fresh"), first);
        assertEquals(List.of("fresh"), second);
    }

    @Test
    @DisplayName("Should isolate failing subscribers")
    void shouldIsolateFailures() {
        List<Object> received = new ArrayList<>();
        notifier.subscribe("page:/a", data -> {
            throw new IllegalStateException("broken view");
        });
        notifier.subscribe("page:/a", received::add);

        int delivered = notifier.notifySubscribers("page:/a", "fresh");

        assertEquals(1, delivered);
        assertEquals(List.of("fresh"), received);
    }

    @Test
    @DisplayName("Should stop delivering after cancel")
    void shouldUnsubscribe() {
        List<Object> received = new ArrayList<>();
        var subscription = notifier.subscribe("page:/a", received::add);

        subscription.cancel();
        notifier.notifySubscribers("page:/a", "fresh");

        assertEquals(List.of(), received);
        assertEquals(0, notifier.subscriberCount("page:/a"));
    }
}
