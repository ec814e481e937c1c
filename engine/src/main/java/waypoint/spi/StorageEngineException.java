package waypoint.spi;

/**
 * Thrown by storage engines when an I/O operation fails.
 */
public class StorageEngineException extends RuntimeException {

    public StorageEngineException(String message) {
        super(message);
    }

    public StorageEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
