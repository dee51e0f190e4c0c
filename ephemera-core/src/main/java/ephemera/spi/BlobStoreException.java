package ephemera.spi;

/**
 * Unchecked exception thrown by {@link BlobStore} implementations.
 */
public class BlobStoreException extends RuntimeException {

    public BlobStoreException(String message) {
        super(message);
    }

    public BlobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
