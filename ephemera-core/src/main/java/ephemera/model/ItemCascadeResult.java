package ephemera.model;

import java.util.List;
import java.util.Objects;

/**
 * What the deletion cascade did for a single content item.
 *
 * @param itemId              the item processed
 * @param deletedItems        rows removed for the item itself (0 or 1)
 * @param deletedLikeEdges    like edges removed
 * @param deletedCommentEdges comment edges removed
 * @param deletedBlobs        blobs removed (0 or 1)
 * @param errors              human-readable failures, in step order
 */
public record ItemCascadeResult(
    String itemId,
    int deletedItems,
    int deletedLikeEdges,
    int deletedCommentEdges,
    int deletedBlobs,
    List<String> errors
) {

  public ItemCascadeResult {
    Objects.requireNonNull(itemId, "itemId");
    errors = List.copyOf(errors);
  }

  /** A result with no deletions and a single error. */
  public static ItemCascadeResult failed(String itemId, String error) {
    return new ItemCascadeResult(itemId, 0, 0, 0, 0, List.of(error));
  }

  public boolean success() {
    return errors.isEmpty();
  }
}
