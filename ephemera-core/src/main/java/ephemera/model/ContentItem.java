package ephemera.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted piece of user content.
 *
 * <p>{@code expiresAt} is present exactly when the item is ephemeral. Engagement counters are
 * maintained by whoever writes likes and comments; this library only reads them.
 *
 * @see ephemera.lifecycle.Expiration
 * @see ephemera.spi.ContentRepository
 */
public record ContentItem(
    String id,
    String ownerId,
    String body,
    String mediaUrl,
    boolean ephemeral,
    Instant createdAt,
    Instant expiresAt,
    int likeCount,
    int commentCount
) {

  public ContentItem {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(body, "body");
    Objects.requireNonNull(createdAt, "createdAt");
    if (ephemeral != (expiresAt != null)) {
      throw new IllegalArgumentException(ephemeral
          ? "Ephemeral item " + id + " must have expiresAt"
          : "Durable item " + id + " must not have expiresAt");
    }
    if (likeCount < 0 || commentCount < 0) {
      throw new IllegalArgumentException("Engagement counters must be >= 0");
    }
  }

  public boolean hasMedia() {
    return mediaUrl != null && !mediaUrl.isEmpty();
  }
}
