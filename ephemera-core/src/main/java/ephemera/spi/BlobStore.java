package ephemera.spi;

/**
 * Deletes media blobs referenced by content items.
 *
 * @see ephemera.blob.HttpBlobStore
 */
@FunctionalInterface
public interface BlobStore {

    /**
     * Deletes the object at {@code path}. Deleting an object that does not exist succeeds.
     *
     * @param path storage path inside the configured bucket
     * @throws BlobStoreException if the store rejects the request or cannot be reached
     */
    void delete(String path);
}
