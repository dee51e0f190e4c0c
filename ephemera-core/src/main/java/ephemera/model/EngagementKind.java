package ephemera.model;

/**
 * Kinds of engagement records that reference a parent {@link ContentItem}.
 */
public enum EngagementKind {
  LIKE("like"),
  COMMENT("comment");

  private final String label;

  EngagementKind(String label) {
    this.label = label;
  }

  /** Lower-case label used in log and error messages. */
  public String label() {
    return label;
  }
}
