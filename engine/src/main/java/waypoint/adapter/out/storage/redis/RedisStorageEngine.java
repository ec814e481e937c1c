package waypoint.adapter.out.storage.redis;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import waypoint.core.port.out.PersistentStorageEngine;
import waypoint.spi.StorageEngineException;

/**
 * Redis implementation of PersistentStorageEngine.
 *
 * <p>Every key is stored under a configurable prefix so the cache can share a
 * database with other data. Key listing uses SCAN rather than KEYS. Operations that do not complete within the timeout fail with
 * {@link StorageEngineException}.
 */
public class RedisStorageEngine implements PersistentStorageEngine {

    private static final Logger LOG = Logger.getLogger(RedisStorageEngine.class);

    static final String DEFAULT_KEY_PREFIX = "waypoint:page-cache:";
    private static final String PING_KEY = "waypoint:health:ping";
    private static final int SCAN_COUNT = 1000;

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final Duration timeout;
    private final String keyPrefix;

    public RedisStorageEngine(ReactiveRedisDataSource ds, Duration timeout, String keyPrefix) {
        this.valueCommands = ds.value(String.class, String.class);
        this.keyCommands = ds.key(String.class);
        this.timeout = timeout;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public Uni<Void> init() {
        return withTimeout(valueCommands.get(PING_KEY), "init")
                .invoke(() -> LOG.info("Redis storage engine connected"))
                .replaceWithVoid();
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return withTimeout(valueCommands.get(keyFor(key)), "get").map(Optional::ofNullable);
    }

    @Override
    public Uni<Void> set(String key, String value) {
        return withTimeout(valueCommands.set(keyFor(key), value), "set");
    }

    @Override
    public Uni<Void> delete(String key) {
        return withTimeout(keyCommands.del(keyFor(key)), "delete").replaceWithVoid();
    }

    @Override
    public Uni<Void> clear() {
        return withTimeout(scanPrefixed(), "clear").flatMap(keys -> {
            if (keys.isEmpty()) {
                return Uni.createFrom().voidItem();
            }
            LOG.debugf("Clearing %d Redis cache keys", keys.size());
            return withTimeout(keyCommands.del(keys.toArray(new String[0])), "clear").replaceWithVoid();
        });
    }

    @Override
    public Uni<List<String>> keys() {
        return withTimeout(scanPrefixed(), "keys")
                .map(keys -> keys.stream().map(k -> k.substring(keyPrefix.length())).toList());
    }

    @Override
    public String name() {
        return "redis";
    }

    private String keyFor(String key) {
        return keyPrefix + key;
    }

    private Uni<List<String>> scanPrefixed() {
        var args = new KeyScanArgs().match(keyPrefix + "*").count(SCAN_COUNT);
        return keyCommands.scan(args).toMulti().collect().asList();
    }

    private <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation.ifNoItem().after(timeout).failWith(() -> {
            LOG.warnv("Redis operation timeout: {0} after {1}", operationName, timeout);
            return new StorageEngineException("Redis " + operationName + " timed out after " + timeout);
        });
    }
}
