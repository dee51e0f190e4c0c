package ephemera.sweep;

import ephemera.model.SweepResult;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs an {@link ExpiredContentSweeper} on a fixed delay from a single daemon thread.
 *
 * <p>A failing sweep is logged and the schedule continues. The scheduler does not own the
 * sweeper; closing it leaves the sweeper open.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class SweepScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SweepScheduler.class.getName());

  private final ExpiredContentSweeper sweeper;
  private final Duration interval;
  private final Duration initialDelay;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile SweepResult lastResult;
  private volatile boolean closed;

  private SweepScheduler(Builder builder) {
    this.sweeper = Objects.requireNonNull(builder.sweeper, "sweeper");
    this.interval = Objects.requireNonNull(builder.interval, "interval");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    this.initialDelay = builder.initialDelay != null ? builder.initialDelay : interval;
    if (initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must be >= 0");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the schedule. Subsequent calls are no-ops while running.
   *
   * @throws IllegalStateException if the scheduler has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("SweepScheduler has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new SweepThreadFactory("scheduler"));
    sweepTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    logger.log(Level.INFO, "Sweeping expired content every {0}", interval);
  }

  /**
   * Runs a single sweep in the calling thread. Does nothing once closed.
   */
  public void runOnce() {
    if (closed) {
      return;
    }
    try {
      lastResult = sweeper.sweep();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Sweep cycle failed", t);
    }
  }

  /** Result of the most recent completed sweep, if any. */
  public Optional<SweepResult> lastResult() {
    return Optional.ofNullable(lastResult);
  }

  /** Cancels the schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link SweepScheduler}. */
  public static final class Builder {
    private ExpiredContentSweeper sweeper;
    private Duration interval = Duration.ofMinutes(5);
    private Duration initialDelay;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder sweeper(ExpiredContentSweeper sweeper) {
      this.sweeper = sweeper;
      return this;
    }

    /**
     * Sets the delay between the end of one sweep and the start of the next.
     *
     * <p>Optional. Defaults to 5 minutes. Must be &gt; 0.
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Sets the delay before the first sweep.
     *
     * <p>Optional. Defaults to the interval. Must be &ge; 0.
     */
    public Builder initialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
      return this;
    }

    public SweepScheduler build() {
      return new SweepScheduler(this);
    }
  }
}
