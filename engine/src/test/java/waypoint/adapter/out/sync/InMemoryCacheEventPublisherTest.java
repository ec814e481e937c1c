package waypoint.adapter.out.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static waypoint.support.TestObjects.TIMEOUT;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import waypoint.core.model.cache.CacheEvent;

@DisplayName("InMemoryCacheEventPublisher")
class InMemoryCacheEventPublisherTest {

    private final InMemoryCacheEventPublisher publisher = new InMemoryCacheEventPublisher();

    @Test
    @DisplayName("Should broadcast events to every current subscriber")
    void shouldBroadcast() {
        List<CacheEvent> first = new CopyOnWriteArrayList<>();
        List<CacheEvent> second = new CopyOnWriteArrayList<>();
        publisher.subscribe().subscribe().with(first::add);
        publisher.subscribe().subscribe().with(second::add);

        var event = new CacheEvent.Invalidated("page:/a", Set.of());
        publisher.publish(event).await().atMost(TIMEOUT);

        assertEquals(List.of(event), first);
        assertEquals(List.of(event), second);
    }

    @Test
    @DisplayName("Should not replay events to late subscribers")
    void shouldNotReplay() {
        publisher.publish(new CacheEvent.Warm(List.of("/a"))).await().atMost(TIMEOUT);

        List<CacheEvent> late = new CopyOnWriteArrayList<>();
        publisher.subscribe().subscribe().with(late::add);

        assertEquals(List.of(), late);
    }
}
