package ephemera.sweep;

import ephemera.model.ContentItem;
import ephemera.model.EngagementKind;
import ephemera.model.ItemCascadeResult;
import ephemera.model.SweepOutcome;
import ephemera.model.SweepResult;
import ephemera.spi.ConnectionProvider;
import ephemera.spi.ContentRepository;
import ephemera.spi.EngagementStore;
import ephemera.spi.SweepMetrics;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reclaims expired ephemeral content.
 *
 * <p>One call to {@link #sweep()} queries up to {@code batchSize} ephemeral items whose
 * {@code expiresAt} lies strictly before the clock's current instant and runs the
 * {@link ItemCascade} for each. Items are independent: a failure in one never stops the others.
 * Leftover items are picked up by the next sweep.
 *
 * <p>With {@code workerCount > 1} items run on a fixed pool of daemon threads; with an
 * {@code itemTimeout} each item is interrupted and recorded as timed out once it exceeds the
 * limit. A timed-out item whose cascade ignores the interrupt stays in flight: later sweeps skip
 * it with an error instead of starting a second cascade. Results are aggregated after all items
 * finish.
 *
 * <p>The sweeper keeps no state between sweeps other than its thread pools and the ids of
 * in-flight items; call {@link #close()} to release them.
 *
 * @see SweepScheduler
 */
public final class ExpiredContentSweeper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ExpiredContentSweeper.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ContentRepository contentRepository;
  private final EngagementStore engagementStore;
  private final ItemCascade cascade;
  private final SweepMetrics metrics;
  private final Clock clock;
  private final int batchSize;
  private final Duration itemTimeout;
  private final boolean reconcileOrphans;

  private final ExecutorService workers;
  private final ExecutorService itemExecutor;
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

  private ExpiredContentSweeper(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.contentRepository = Objects.requireNonNull(builder.contentRepository, "contentRepository");
    this.cascade = Objects.requireNonNull(builder.cascade, "cascade");
    this.reconcileOrphans = builder.reconcileOrphans;
    this.engagementStore = reconcileOrphans
        ? Objects.requireNonNull(builder.engagementStore, "engagementStore")
        : builder.engagementStore;

    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be > 0");
    }
    if (builder.itemTimeout != null && (builder.itemTimeout.isNegative() || builder.itemTimeout.isZero())) {
      throw new IllegalArgumentException("itemTimeout must be > 0");
    }

    this.metrics = builder.metrics != null ? builder.metrics : SweepMetrics.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.batchSize = builder.batchSize;
    this.itemTimeout = builder.itemTimeout;

    this.workers = builder.workerCount > 1
        ? Executors.newFixedThreadPool(builder.workerCount, new SweepThreadFactory("worker"))
        : null;
    this.itemExecutor = itemTimeout != null
        ? Executors.newCachedThreadPool(new SweepThreadFactory("item"))
        : null;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs one sweep and returns its aggregated result. Never throws for storage failures: a failed
   * expired-items query yields a {@link SweepOutcome#FAILURE} result, per-item failures yield
   * {@link SweepOutcome#PARTIAL_SUCCESS}.
   */
  public SweepResult sweep() {
    long started = System.nanoTime();
    Instant now = clock.instant();

    List<ContentItem> expired;
    try {
      expired = queryExpired(now);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to fetch expired items", e);
      return finish(SweepResult.queryFailure("Failed to fetch expired items: " + e.getMessage()), started);
    }

    if (!expired.isEmpty()) {
      logger.log(Level.FINE, "Sweeping {0} expired items (cutoff {1})", new Object[]{expired.size(), now});
    }
    List<ItemCascadeResult> items = processAll(expired);

    List<String> reconciliationErrors = new ArrayList<>();
    int reclaimed = reconcileOrphans ? reconcile(reconciliationErrors) : 0;

    SweepResult result = SweepResult.aggregate(expired.size(), items, reclaimed, reconciliationErrors);
    return finish(result, started);
  }

  private List<ContentItem> queryExpired(Instant now) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return contentRepository.queryExpiredEphemeral(conn, now, batchSize);
    }
  }

  private List<ItemCascadeResult> processAll(List<ContentItem> expired) {
    List<ItemCascadeResult> results = new ArrayList<>(expired.size());
    if (workers == null) {
      for (ContentItem item : expired) {
        results.add(process(item));
      }
      return results;
    }

    List<Future<ItemCascadeResult>> futures = new ArrayList<>(expired.size());
    for (ContentItem item : expired) {
      futures.add(workers.submit(() -> process(item)));
    }
    for (int i = 0; i < futures.size(); i++) {
      String id = expired.get(i).id();
      try {
        results.add(futures.get(i).get());
      } catch (ExecutionException e) {
        results.add(unexpected(id, e.getCause()));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        for (int j = i; j < futures.size(); j++) {
          futures.get(j).cancel(true);
          results.add(unexpected(expired.get(j).id(), e));
        }
        break;
      }
    }
    return results;
  }

  private ItemCascadeResult process(ContentItem item) {
    if (itemExecutor == null) {
      return runCascade(item);
    }
    String id = item.id();
    if (!inFlight.add(id)) {
      logger.log(Level.WARNING, "Item {0} is still being processed by an earlier sweep; skipping", id);
      return ItemCascadeResult.failed(id, "Item " + id + " is still being processed by an earlier sweep");
    }
    // Whoever claims first owns removal from inFlight: the task once it runs, or this thread
    // when the task is cancelled before it starts.
    AtomicBoolean claimed = new AtomicBoolean();
    AtomicBoolean abandoned = new AtomicBoolean();
    Future<ItemCascadeResult> future = itemExecutor.submit(() -> {
      if (!claimed.compareAndSet(false, true)) {
        return ItemCascadeResult.failed(id, "Cancelled before processing item " + id);
      }
      ItemCascadeResult result = null;
      try {
        result = runCascade(item);
        return result;
      } finally {
        inFlight.remove(id);
        if (abandoned.get()) {
          logger.log(Level.WARNING, "Item {0} finished after timing out: {1}",
              new Object[]{id, result != null ? result : "no result"});
        }
      }
    });
    try {
      return future.get(itemTimeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      abandon(id, future, claimed, abandoned);
      logger.log(Level.WARNING, "Timed out processing item {0} after {1}", new Object[]{id, itemTimeout});
      return ItemCascadeResult.failed(id, "Timed out processing item " + id + " after " + itemTimeout);
    } catch (ExecutionException e) {
      return unexpected(id, e.getCause());
    } catch (InterruptedException e) {
      abandon(id, future, claimed, abandoned);
      Thread.currentThread().interrupt();
      return unexpected(id, e);
    }
  }

  private void abandon(String id, Future<?> future, AtomicBoolean claimed, AtomicBoolean abandoned) {
    abandoned.set(true);
    future.cancel(true);
    if (claimed.compareAndSet(false, true)) {
      inFlight.remove(id);
    }
  }

  /** Number of items whose cascade is still running, including ones that timed out. */
  int inFlightCount() {
    return inFlight.size();
  }

  private ItemCascadeResult runCascade(ContentItem item) {
    try {
      return cascade.run(item);
    } catch (RuntimeException e) {
      return unexpected(item.id(), e);
    }
  }

  private static ItemCascadeResult unexpected(String id, Throwable t) {
    logger.log(Level.WARNING, "Unexpected error for item " + id, t);
    return ItemCascadeResult.failed(id, "Unexpected error for item " + id + ": " + t.getMessage());
  }

  private int reconcile(List<String> errors) {
    int reclaimed = 0;
    for (EngagementKind kind : EngagementKind.values()) {
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        reclaimed += engagementStore.deleteOrphans(conn, kind, batchSize);
      } catch (SQLException | RuntimeException e) {
        logger.log(Level.WARNING, "Failed to reconcile orphaned " + kind.label() + " edges", e);
        errors.add("Failed to reconcile orphaned " + kind.label() + " edges: " + e.getMessage());
      }
    }
    return reclaimed;
  }

  private SweepResult finish(SweepResult result, long startedNanos) {
    Duration took = Duration.ofNanos(System.nanoTime() - startedNanos);
    if (result.outcome() == SweepOutcome.SUCCESS) {
      if (result.expiredItems() > 0 || result.reclaimedOrphanEdges() > 0) {
        logger.log(Level.INFO, "Sweep deleted {0} items, {1} likes, {2} comments, {3} blobs, {4} orphans in {5} ms",
            new Object[]{result.deletedItems(), result.deletedLikeEdges(), result.deletedCommentEdges(),
                result.deletedBlobs(), result.reclaimedOrphanEdges(), took.toMillis()});
      }
    } else if (result.outcome() == SweepOutcome.PARTIAL_SUCCESS) {
      logger.log(Level.WARNING, "Sweep completed with {0} errors ({1} of {2} items deleted)",
          new Object[]{result.errors().size(), result.deletedItems(), result.expiredItems()});
      for (String error : result.errors()) {
        logger.log(Level.WARNING, error);
      }
    }
    try {
      metrics.recordSweep(result, took);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to record sweep metrics", e);
    }
    return result;
  }

  /** Shuts down the worker pools, interrupting items still in progress. */
  @Override
  public void close() {
    shutdown(workers);
    shutdown(itemExecutor);
  }

  private static void shutdown(ExecutorService executor) {
    if (executor == null) {
      return;
    }
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link ExpiredContentSweeper}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ContentRepository contentRepository;
    private EngagementStore engagementStore;
    private ItemCascade cascade;
    private SweepMetrics metrics;
    private Clock clock;
    private int batchSize = 1000;
    private int workerCount = 1;
    private Duration itemTimeout;
    private boolean reconcileOrphans;

    private Builder() {}

    /**
     * Sets the connection provider used for the expired-items query and orphan reconciliation.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> Source of expired items. */
    public Builder contentRepository(ContentRepository contentRepository) {
      this.contentRepository = contentRepository;
      return this;
    }

    /**
     * Sets the engagement store used for orphan reconciliation.
     *
     * <p>Required only when {@link #reconcileOrphans(boolean)} is enabled.
     */
    public Builder engagementStore(EngagementStore engagementStore) {
      this.engagementStore = engagementStore;
      return this;
    }

    /** <b>Required.</b> The per-item deletion cascade. */
    public Builder cascade(ItemCascade cascade) {
      this.cascade = cascade;
      return this;
    }

    /** Optional. Defaults to {@link SweepMetrics#NOOP}. */
    public Builder metrics(SweepMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the maximum number of expired items handled by one sweep. Also caps the number of
     * orphaned edges reclaimed per kind.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the number of items processed concurrently.
     *
     * <p>Optional. Defaults to {@code 1}, which runs items one after another in the calling
     * thread. Must be &gt; 0.
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the maximum time one item's cascade may take before it is interrupted.
     *
     * <p>Optional. Unbounded by default. Must be &gt; 0 when set.
     */
    public Builder itemTimeout(Duration itemTimeout) {
      this.itemTimeout = itemTimeout;
      return this;
    }

    /**
     * Enables deletion of like and comment edges whose parent item no longer exists, after the
     * per-item phase of every sweep.
     *
     * <p>Optional. Defaults to {@code false}.
     */
    public Builder reconcileOrphans(boolean reconcileOrphans) {
      this.reconcileOrphans = reconcileOrphans;
      return this;
    }

    /**
     * @throws NullPointerException if a required collaborator is missing
     * @throws IllegalArgumentException if {@code batchSize}, {@code workerCount} or
     *     {@code itemTimeout} is out of range
     */
    public ExpiredContentSweeper build() {
      return new ExpiredContentSweeper(this);
    }
  }
}
