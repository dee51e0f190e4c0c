package ephemera.model;

/**
 * A preset status phrase. A submission whose body is exactly the template's canonical text
 * (ignoring surrounding whitespace) and carries no media becomes ephemeral.
 *
 * <p>Canonical texts have the form {@code "<emoji> <label>"}.
 */
public interface CanonicalTemplate {

  /** Stable identifier, e.g. {@code "cafe"}. */
  String key();

  /** The exact text that marks a submission as a status post. */
  String canonicalText();

  default String emoji() {
    String text = canonicalText();
    int space = text.indexOf(' ');
    return space < 0 ? text : text.substring(0, space);
  }

  default String label() {
    String text = canonicalText();
    int space = text.indexOf(' ');
    return space < 0 ? "" : text.substring(space + 1);
  }
}
