package ephemera.sweep;

import ephemera.model.ContentItem;
import ephemera.model.EngagementKind;
import ephemera.model.ItemCascadeResult;
import ephemera.spi.BlobStore;
import ephemera.spi.ConnectionProvider;
import ephemera.spi.ContentDeletionListener;
import ephemera.spi.ContentRepository;
import ephemera.spi.EngagementStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deletes one content item together with everything that depends on it.
 *
 * <p>Steps run in a fixed order: media blob, like edges, comment edges, item row. A failing step
 * is recorded and the remaining steps still run, so a later sweep only has to retry what is left.
 * Each database step uses its own auto-committed connection; no transaction spans steps.
 *
 * <p>Shared by {@link ExpiredContentSweeper} and explicit owner deletion. Thread-safe if the
 * collaborators are.
 */
public final class ItemCascade {
  private static final Logger logger = Logger.getLogger(ItemCascade.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ContentRepository contentRepository;
  private final EngagementStore engagementStore;
  private final BlobStore blobStore;
  private final String bucket;
  private final ContentDeletionListener deletionListener;

  private ItemCascade(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.contentRepository = Objects.requireNonNull(builder.contentRepository, "contentRepository");
    this.engagementStore = Objects.requireNonNull(builder.engagementStore, "engagementStore");
    this.blobStore = Objects.requireNonNull(builder.blobStore, "blobStore");
    this.bucket = Objects.requireNonNull(builder.bucket, "bucket");
    if (bucket.isEmpty() || bucket.contains("/")) {
      throw new IllegalArgumentException("bucket must be a single non-empty path segment");
    }
    this.deletionListener = builder.deletionListener != null
        ? builder.deletionListener : ContentDeletionListener.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs the cascade for {@code item}. Never throws; every failure is reported in the result.
   */
  public ItemCascadeResult run(ContentItem item) {
    String id = item.id();
    try {
      List<String> errors = new ArrayList<>();
      int blobs = deleteBlob(item, errors);
      if (Thread.currentThread().isInterrupted()) {
        return interrupted(id, 0, 0, blobs, errors);
      }
      int likes = deleteEdges(id, EngagementKind.LIKE, errors);
      int comments = deleteEdges(id, EngagementKind.COMMENT, errors);
      if (Thread.currentThread().isInterrupted()) {
        return interrupted(id, likes, comments, blobs, errors);
      }
      int rows = deleteRow(item, errors);
      logger.log(Level.FINE, "Cascade for item {0}: rows={1}, likes={2}, comments={3}, blobs={4}",
          new Object[]{id, rows, likes, comments, blobs});
      return new ItemCascadeResult(id, rows, likes, comments, blobs, errors);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Unexpected error for item " + id, e);
      return ItemCascadeResult.failed(id, "Unexpected error for item " + id + ": " + e.getMessage());
    }
  }

  // Cancelled by a timeout; the item row stays so the next sweep retries it.
  private static ItemCascadeResult interrupted(String id, int likes, int comments, int blobs, List<String> errors) {
    errors.add("Interrupted while deleting item " + id);
    return new ItemCascadeResult(id, 0, likes, comments, blobs, errors);
  }

  private int deleteBlob(ContentItem item, List<String> errors) {
    if (!item.hasMedia()) {
      return 0;
    }
    Optional<String> path = BlobPaths.extract(item.mediaUrl(), bucket);
    if (path.isEmpty()) {
      logger.log(Level.WARNING, "Could not extract blob path from {0} for item {1}; skipping blob",
          new Object[]{item.mediaUrl(), item.id()});
      return 0;
    }
    try {
      blobStore.delete(path.get());
      return 1;
    } catch (RuntimeException e) {
      errors.add("Failed to delete blob for item " + item.id() + ": " + e.getMessage());
      return 0;
    }
  }

  private int deleteEdges(String id, EngagementKind kind, List<String> errors) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return engagementStore.deleteByParent(conn, id, kind);
    } catch (SQLException | RuntimeException e) {
      errors.add("Failed to delete " + kind.label() + " edges for item " + id + ": " + e.getMessage());
      return 0;
    }
  }

  private int deleteRow(ContentItem item, List<String> errors) {
    int deleted;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      deleted = contentRepository.delete(conn, item.id());
    } catch (SQLException | RuntimeException e) {
      errors.add("Failed to delete item " + item.id() + ": " + e.getMessage());
      return 0;
    }
    if (deleted > 0) {
      notifyDeleted(item);
    }
    return deleted;
  }

  private void notifyDeleted(ContentItem item) {
    try {
      deletionListener.onDeleted(item);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Deletion listener failed for item " + item.id(), e);
    }
  }

  /** Builder for {@link ItemCascade}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ContentRepository contentRepository;
    private EngagementStore engagementStore;
    private BlobStore blobStore;
    private String bucket = "audio";
    private ContentDeletionListener deletionListener;

    private Builder() {}

    /** <b>Required.</b> Source of one auto-commit connection per step. */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder contentRepository(ContentRepository contentRepository) {
      this.contentRepository = contentRepository;
      return this;
    }

    /** <b>Required.</b> */
    public Builder engagementStore(EngagementStore engagementStore) {
      this.engagementStore = engagementStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder blobStore(BlobStore blobStore) {
      this.blobStore = blobStore;
      return this;
    }

    /**
     * Sets the bucket name whose {@code /<bucket>/} URL segment precedes the blob path.
     *
     * <p>Optional. Defaults to {@code "audio"}.
     */
    public Builder bucket(String bucket) {
      this.bucket = bucket;
      return this;
    }

    /** Optional. Notified after an item row is deleted. */
    public Builder deletionListener(ContentDeletionListener deletionListener) {
      this.deletionListener = deletionListener;
      return this;
    }

    public ItemCascade build() {
      return new ItemCascade(this);
    }
  }
}
