package ephemera.model;

/**
 * Overall outcome of one sweep, with the HTTP status a trigger endpoint reports for it.
 */
public enum SweepOutcome {
  /** No errors. */
  SUCCESS(200),
  /** At least one per-item or reconciliation step failed; others may have succeeded. */
  PARTIAL_SUCCESS(207),
  /** The expired-items query failed; nothing was processed. */
  FAILURE(500);

  private final int httpStatus;

  SweepOutcome(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
