package ephemera.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated result of one sweep. Never persisted; returned to the caller, logged and exported
 * as metrics.
 *
 * @param expiredItems         items matched by the expired-items query
 * @param deletedItems         item rows removed
 * @param deletedLikeEdges     like edges removed by item cascades
 * @param deletedCommentEdges  comment edges removed by item cascades
 * @param deletedBlobs         media blobs removed
 * @param reclaimedOrphanEdges edges removed by orphan reconciliation
 * @param errors               every failure message, in item order
 * @param outcome              overall outcome
 */
public record SweepResult(
    int expiredItems,
    int deletedItems,
    int deletedLikeEdges,
    int deletedCommentEdges,
    int deletedBlobs,
    int reclaimedOrphanEdges,
    List<String> errors,
    SweepOutcome outcome
) {

  public SweepResult {
    errors = List.copyOf(errors);
    Objects.requireNonNull(outcome, "outcome");
  }

  /** Result of a sweep whose expired-items query failed. */
  public static SweepResult queryFailure(String error) {
    return new SweepResult(0, 0, 0, 0, 0, 0, List.of(error), SweepOutcome.FAILURE);
  }

  /**
   * Sums per-item results. The outcome is {@link SweepOutcome#SUCCESS} when no errors were
   * recorded and {@link SweepOutcome#PARTIAL_SUCCESS} otherwise, even if nothing was deleted.
   */
  public static SweepResult aggregate(int expiredItems, List<ItemCascadeResult> items,
      int reclaimedOrphanEdges, List<String> reconciliationErrors) {
    int deletedItems = 0;
    int deletedLikes = 0;
    int deletedComments = 0;
    int deletedBlobs = 0;
    List<String> errors = new ArrayList<>();
    for (ItemCascadeResult item : items) {
      deletedItems += item.deletedItems();
      deletedLikes += item.deletedLikeEdges();
      deletedComments += item.deletedCommentEdges();
      deletedBlobs += item.deletedBlobs();
      errors.addAll(item.errors());
    }
    errors.addAll(reconciliationErrors);
    SweepOutcome outcome = errors.isEmpty() ? SweepOutcome.SUCCESS : SweepOutcome.PARTIAL_SUCCESS;
    return new SweepResult(expiredItems, deletedItems, deletedLikes, deletedComments,
        deletedBlobs, reclaimedOrphanEdges, errors, outcome);
  }

  public boolean success() {
    return errors.isEmpty();
  }

  public String message() {
    return switch (outcome) {
      case FAILURE -> "Failed to fetch expired items";
      case PARTIAL_SUCCESS -> "Completed with " + errors.size() + " errors";
      case SUCCESS -> expiredItems == 0 && reclaimedOrphanEdges == 0
          ? "No expired items to delete"
          : "Successfully deleted " + deletedItems + " expired items";
    };
  }

  /**
   * JSON-ready response body for a sweep trigger:
   * {@code {success, result: {deletedPosts, deletedLikes, deletedComments, deletedAudioFiles,
   * errors}, message}}. A failed query additionally carries {@code error}.
   */
  public Map<String, Object> toResponseBody() {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("deletedPosts", deletedItems);
    result.put("deletedLikes", deletedLikeEdges);
    result.put("deletedComments", deletedCommentEdges);
    result.put("deletedAudioFiles", deletedBlobs);
    result.put("errors", errors);
    if (reclaimedOrphanEdges > 0) {
      result.put("reclaimedOrphanEdges", reclaimedOrphanEdges);
    }

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", success());
    body.put("result", result);
    if (outcome == SweepOutcome.FAILURE && !errors.isEmpty()) {
      body.put("error", errors.get(0));
    }
    body.put("message", message());
    return body;
  }
}
