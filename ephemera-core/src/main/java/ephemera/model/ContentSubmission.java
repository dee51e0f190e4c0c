package ephemera.model;

import java.util.Objects;

/**
 * A not-yet-persisted post as proposed by its owner.
 *
 * @param ownerId  the posting user
 * @param body     proposed body text
 * @param mediaUrl optional attached media URL, {@code null} when none
 * @param template the status preset selected in the composer, {@code null} when none
 */
public record ContentSubmission(
    String ownerId,
    String body,
    String mediaUrl,
    CanonicalTemplate template
) {

  public ContentSubmission {
    Objects.requireNonNull(ownerId, "ownerId");
  }

  public static ContentSubmission text(String ownerId, String body) {
    return new ContentSubmission(ownerId, body, null, null);
  }

  public static ContentSubmission status(String ownerId, CanonicalTemplate template) {
    return new ContentSubmission(ownerId, template.canonicalText(), null, template);
  }

  public boolean hasMedia() {
    return mediaUrl != null && !mediaUrl.isEmpty();
  }
}
