package waypoint.adapter.out.storage.file;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import waypoint.core.port.out.PersistentStorageEngine;
import waypoint.spi.StorageEngineException;

/**
 * Storage engine keeping one file per key in a directory.
 *
 * <p>File names are the URL-safe Base64 encoding of the key. Writes go to a
 * temporary file that is then moved over the target, so readers never see a
 * partial value. File I/O runs on the Mutiny worker pool.
 */
public class FileStorageEngine implements PersistentStorageEngine {

    private static final Logger LOG = Logger.getLogger(FileStorageEngine.class);

    static final String FILE_SUFFIX = ".entry";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;

    public FileStorageEngine(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    @Override
    public Uni<Void> init() {
        return io(() -> {
            Files.createDirectories(directory);
            LOG.infof("File storage engine using %s", directory);
            return null;
        });
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return io(() -> {
            try {
                return Optional.of(Files.readString(pathFor(key), StandardCharsets.UTF_8));
            } catch (NoSuchFileException e) {
                return Optional.empty();
            }
        });
    }

    @Override
    public Uni<Void> set(String key, String value) {
        return io(() -> {
            Path target = pathFor(key);
            Path temp = directory.resolve(UUID.randomUUID() + TEMP_SUFFIX);
            Files.writeString(temp, value, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return null;
        });
    }

    @Override
    public Uni<Void> delete(String key) {
        return io(() -> {
            Files.deleteIfExists(pathFor(key));
            return null;
        });
    }

    @Override
    public Uni<Void> clear() {
        return io(() -> {
            for (Path file : entryFiles()) {
                Files.deleteIfExists(file);
            }
            return null;
        });
    }

    @Override
    public Uni<List<String>> keys() {
        return io(() -> entryFiles().stream().map(FileStorageEngine::keyOf).toList());
    }

    @Override
    public String name() {
        return "file";
    }

    /**
     * Total size of all entry files.
     */
    public Uni<Long> usedBytes() {
        return io(() -> {
            long total = 0;
            for (Path file : entryFiles()) {
                try {
                    total += Files.size(file);
                } catch (NoSuchFileException e) {
                    LOG.tracef("Entry file %s removed while scanning", file);
                }
            }
            return total;
        });
    }

    Path pathFor(String key) {
        String encoded = Base64.getUrlEncoder().withoutPadding().encodeToString(key.getBytes(StandardCharsets.UTF_8));
        return directory.resolve(encoded + FILE_SUFFIX);
    }

    private static String keyOf(Path file) {
        String name = file.getFileName().toString();
        String encoded = name.substring(0, name.length() - FILE_SUFFIX.length());
        return new String(Base64.getUrlDecoder().decode(encoded), StandardCharsets.UTF_8);
    }

    private List<Path> entryFiles() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(p -> p.getFileName().toString().endsWith(FILE_SUFFIX))
                    .toList();
        }
    }

    private <T> Uni<T> io(Callable<T> action) {
        return Uni.createFrom()
                .<T>emitter(emitter -> {
                    try {
                        emitter.complete(action.call());
                    } catch (Exception e) {
                        emitter.fail(new StorageEngineException("File storage operation failed in " + directory, e));
                    }
                })
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }
}
