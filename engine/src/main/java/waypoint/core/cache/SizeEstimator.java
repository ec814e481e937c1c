package waypoint.core.cache;

import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

/**
 * Approximates the footprint of a payload by the UTF-8 length of its JSON form.
 */
public class SizeEstimator {

    private static final Logger LOG = Logger.getLogger(SizeEstimator.class);

    private final ObjectMapper objectMapper;

    public SizeEstimator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Estimates the size of a value.
     *
     * @param value the payload, may be null
     * @return size in bytes, 0 if the value is null or cannot be serialized
     */
    public long estimate(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof String s) {
            return s.getBytes(StandardCharsets.UTF_8).length;
        }
        try {
            return objectMapper.writeValueAsBytes(value).length;
        } catch (JsonProcessingException e) {
            LOG.debugf("Cannot estimate size of %s: %s", value.getClass().getName(), e.getMessage());
            return 0;
        }
    }
}
