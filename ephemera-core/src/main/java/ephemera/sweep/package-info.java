/**
 * Reclamation of expired ephemeral content.
 *
 * <p>{@link ephemera.sweep.ExpiredContentSweeper} finds expired items and runs an
 * {@link ephemera.sweep.ItemCascade} per item; {@link ephemera.sweep.SweepScheduler} triggers it
 * periodically.
 */
package ephemera.sweep;
