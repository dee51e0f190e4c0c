package ephemera.lifecycle;

import ephemera.model.ContentItem;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * TTL assignment and expiration checks for ephemeral content.
 */
public final class Expiration {

  /** Fixed lifetime of a status post. */
  public static final Duration STATUS_LIFETIME = Duration.ofHours(3);

  private Expiration() {}

  public static Instant assignExpiry(Instant createdAt) {
    Objects.requireNonNull(createdAt, "createdAt");
    return createdAt.plus(STATUS_LIFETIME);
  }

  /**
   * Returns {@code true} if the item is ephemeral and {@code now} is strictly after its expiry.
   * An item is still alive at exactly {@code expiresAt}.
   */
  public static boolean isExpired(ContentItem item, Instant now) {
    return item.ephemeral() && item.expiresAt() != null && now.isAfter(item.expiresAt());
  }

  /**
   * Time left until expiry, negative once expired, or {@code null} for durable items.
   */
  public static Duration remainingLife(ContentItem item, Instant now) {
    if (!item.ephemeral() || item.expiresAt() == null) {
      return null;
    }
    return Duration.between(now, item.expiresAt());
  }
}
