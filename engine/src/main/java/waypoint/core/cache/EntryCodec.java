package waypoint.core.cache;

import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import waypoint.core.model.cache.CacheEntry;

/**
 * Converts cache entries to and from the opaque JSON blobs held by storage engines.
 *
 * <p>Payloads come back in Jackson's untyped form: maps, lists and scalars.
 */
public class EntryCodec {

    private static final Logger LOG = Logger.getLogger(EntryCodec.class);
    private static final TypeReference<CacheEntry<Object>> ENTRY_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public EntryCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Serializes an entry.
     *
     * @throws IllegalArgumentException if the payload cannot be serialized
     */
    public String encode(CacheEntry<?> entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache entry payload is not serializable", e);
        }
    }

    /**
     * Deserializes a stored blob.
     *
     * @return the entry, or empty if the blob is corrupt
     */
    public Optional<CacheEntry<Object>> decode(String key, String blob) {
        try {
            return Optional.of(objectMapper.readValue(blob, ENTRY_TYPE));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.warnf("Discarding unreadable cache entry %s: %s", key, e.getMessage());
            return Optional.empty();
        }
    }
}
