package ephemera.spi;

import ephemera.model.SweepResult;

import java.time.Duration;

/**
 * Observability hook for exporting sweep results to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything.
 */
public interface SweepMetrics {

    /**
     * No-op instance that discards all metrics.
     */
    SweepMetrics NOOP = new Noop();

    /**
     * Records one finished sweep.
     *
     * @param result   the aggregated sweep result
     * @param duration wall-clock time the sweep took
     */
    void recordSweep(SweepResult result, Duration duration);

    /** No-op implementation. */
    final class Noop implements SweepMetrics {
        @Override
        public void recordSweep(SweepResult result, Duration duration) {
        }
    }
}
