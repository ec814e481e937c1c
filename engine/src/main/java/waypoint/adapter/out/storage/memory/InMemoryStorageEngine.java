package waypoint.adapter.out.storage.memory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import waypoint.core.port.out.PersistentStorageEngine;

/**
 * In-memory storage engine.
 *
 * <p>Data is NOT persisted across restarts. Useful for tests and for
 * deployments where the durable tier only needs to outlive volatile evictions.
 */
public class InMemoryStorageEngine implements PersistentStorageEngine {

    private final Map<String, String> storage = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> init() {
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storage.get(key)));
    }

    @Override
    public Uni<Void> set(String key, String value) {
        return Uni.createFrom().item(() -> {
            storage.put(key, value);
            return null;
        });
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().item(() -> {
            storage.remove(key);
            return null;
        });
    }

    @Override
    public Uni<Void> clear() {
        return Uni.createFrom().item(() -> {
            storage.clear();
            return null;
        });
    }

    @Override
    public Uni<List<String>> keys() {
        return Uni.createFrom().item(() -> List.copyOf(storage.keySet()));
    }

    @Override
    public String name() {
        return "memory";
    }

    /**
     * Bytes held, counting each character as two bytes.
     */
    public long usedBytes() {
        return storage.entrySet().stream()
                .mapToLong(e -> 2L * (e.getKey().length() + e.getValue().length()))
                .sum();
    }
}
