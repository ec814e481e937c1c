package waypoint.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Asynchronous key-value engine backing the durable cache tier.
 *
 * <p>Values are opaque serialized cache entries. Implementations must survive a
 * process restart unless documented otherwise, and must not block the caller.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>{@link #init()} is idempotent</li>
 *   <li>Deleting an absent key completes normally</li>
 *   <li>I/O failures surface as failed {@link Uni}s</li>
 * </ul>
 */
public interface PersistentStorageEngine {

    /**
     * Prepares the engine (opens files, checks connectivity).
     *
     * @return Uni completing when the engine is usable
     */
    Uni<Void> init();

    Uni<Optional<String>> get(String key);

    Uni<Void> set(String key, String value);

    Uni<Void> delete(String key);

    Uni<Void> clear();

    /**
     * Lists every stored key.
     *
     * @return Uni with the stored keys, in no particular order
     */
    Uni<List<String>> keys();

    /**
     * Short name for logging.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
