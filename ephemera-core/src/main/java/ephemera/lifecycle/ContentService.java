package ephemera.lifecycle;

import ephemera.model.ContentItem;
import ephemera.model.ContentSubmission;
import ephemera.model.ItemCascadeResult;
import ephemera.spi.ConnectionProvider;
import ephemera.spi.ContentRepository;
import ephemera.sweep.ItemCascade;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creation, lookup and explicit deletion of content items.
 *
 * <p>Classification and expiry are decided once, at submission. Explicit deletion runs the same
 * cascade as the sweeper.
 */
public final class ContentService {
  private static final Logger logger = Logger.getLogger(ContentService.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ContentRepository contentRepository;
  private final ItemCascade cascade;
  private final Clock clock;

  public ContentService(ConnectionProvider connectionProvider, ContentRepository contentRepository,
      ItemCascade cascade, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.contentRepository = Objects.requireNonNull(contentRepository, "contentRepository");
    this.cascade = Objects.requireNonNull(cascade, "cascade");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Classifies and stores a submission.
   *
   * @throws IllegalArgumentException if the body is blank
   * @throws IllegalStateException if a connection cannot be obtained
   */
  public ContentItem submit(ContentSubmission submission) {
    Objects.requireNonNull(submission, "submission");
    if (submission.body() == null || submission.body().isBlank()) {
      throw new IllegalArgumentException("body must not be blank");
    }
    Instant now = clock.instant();
    boolean ephemeral = ContentClassifier.isEphemeral(submission);
    ContentItem item = new ContentItem(
        UUID.randomUUID().toString(),
        submission.ownerId(),
        submission.body(),
        submission.hasMedia() ? submission.mediaUrl() : null,
        ephemeral,
        now,
        ephemeral ? Expiration.assignExpiry(now) : null,
        0,
        0);
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      contentRepository.insert(conn, item);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to obtain connection for submission", e);
    }
    logger.log(Level.FINE, "Stored {0} item {1}", new Object[]{ephemeral ? "ephemeral" : "durable", item.id()});
    return item;
  }

  public Optional<ContentItem> find(String id) {
    Objects.requireNonNull(id, "id");
    try (Connection conn = connectionProvider.getConnection()) {
      return contentRepository.findById(conn, id);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to obtain connection for lookup", e);
    }
  }

  /**
   * Deletes an item and its dependents. Returns an empty result if the item does not exist.
   */
  public ItemCascadeResult delete(String id) {
    Optional<ContentItem> item = find(id);
    if (item.isEmpty()) {
      return new ItemCascadeResult(id, 0, 0, 0, 0, List.of());
    }
    return cascade.run(item.get());
  }
}
