package ephemera.lifecycle;

import ephemera.model.CanonicalTemplate;
import ephemera.model.ContentSubmission;

/**
 * Decides at creation time whether a submission is an ephemeral status post.
 *
 * <p>A submission is ephemeral only when a template is selected, the body equals the template's
 * canonical text after stripping leading and trailing whitespace, and no media is attached. Any
 * edit of the preset text, including appending words, makes the post durable. Comparison is
 * exact: no case folding and no partial matching.
 */
public final class ContentClassifier {

  private ContentClassifier() {}

  public static boolean isEphemeral(String proposedBody, boolean hasMedia, CanonicalTemplate selectedTemplate) {
    if (selectedTemplate == null || hasMedia) {
      return false;
    }
    if (proposedBody == null || proposedBody.isEmpty()) {
      return false;
    }
    String canonical = selectedTemplate.canonicalText();
    if (canonical == null) {
      return false;
    }
    return proposedBody.strip().equals(canonical.strip());
  }

  public static boolean isEphemeral(ContentSubmission submission) {
    return isEphemeral(submission.body(), submission.hasMedia(), submission.template());
  }
}
