package waypoint.adapter.out.storage.redis;

import java.time.Duration;

import jakarta.enterprise.inject.spi.CDI;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import waypoint.core.port.out.PersistentStorageEngine;
import waypoint.spi.StorageAdapterConfig;
import waypoint.spi.StorageEngineProvider;
import waypoint.spi.StorageProviderException;

/**
 * Redis storage engine provider.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>waypoint.storage.redis.timeout - operation timeout in ISO-8601 duration format (default: PT1S)</li>
 *   <li>waypoint.storage.redis.key-prefix - prefix of every cache key (default: waypoint:page-cache:)</li>
 * </ul>
 *
 * <p>Redis connection is configured via Quarkus Redis properties:
 * <ul>
 *   <li>quarkus.redis.hosts - Redis server URL (default: redis://localhost:6379)</li>
 *   <li>quarkus.redis.password - Redis password (optional)</li>
 * </ul>
 */
public class RedisStorageEngineProvider implements StorageEngineProvider {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1);

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public String description() {
        return "Redis shared storage";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("io.quarkus.redis.datasource.ReactiveRedisDataSource");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public PersistentStorageEngine createEngine(StorageAdapterConfig config) {
        Duration timeout = config.getDuration("waypoint.storage.redis.timeout").orElse(DEFAULT_TIMEOUT);
        String keyPrefix =
                config.getOrDefault("waypoint.storage.redis.key-prefix", RedisStorageEngine.DEFAULT_KEY_PREFIX);

        ReactiveRedisDataSource dataSource;
        try {
            dataSource = CDI.current().select(ReactiveRedisDataSource.class).get();
        } catch (Exception e) {
            throw new StorageProviderException("Failed to obtain Redis data source from CDI", e);
        }

        return new RedisStorageEngine(dataSource, timeout, keyPrefix);
    }
}
