package ephemera.micrometer;

import ephemera.model.SweepOutcome;
import ephemera.model.SweepResult;
import ephemera.spi.SweepMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link SweepMetrics}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code ephemera.sweep.items.deleted} - content rows removed</li>
 *   <li>{@code ephemera.sweep.likes.deleted} - like edges removed</li>
 *   <li>{@code ephemera.sweep.comments.deleted} - comment edges removed</li>
 *   <li>{@code ephemera.sweep.blobs.deleted} - media blobs removed</li>
 *   <li>{@code ephemera.sweep.orphans.reclaimed} - orphaned edges removed</li>
 *   <li>{@code ephemera.sweep.errors} - failure messages recorded</li>
 *   <li>{@code ephemera.sweep.runs{outcome}} - sweeps by outcome</li>
 * </ul>
 *
 * <h3>Timer</h3>
 * {@code ephemera.sweep.duration}
 *
 * <h3>Gauge</h3>
 * {@code ephemera.sweep.last.expired} - expired items matched by the latest sweep
 *
 * @see SweepMetrics
 */
public final class MicrometerSweepMetrics implements SweepMetrics, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter itemsDeleted;
  private final Counter likesDeleted;
  private final Counter commentsDeleted;
  private final Counter blobsDeleted;
  private final Counter orphansReclaimed;
  private final Counter errors;
  private final Map<SweepOutcome, Counter> runs = new EnumMap<>(SweepOutcome.class);
  private final Timer duration;
  private final Gauge lastExpiredGauge;

  private final AtomicInteger lastExpired = new AtomicInteger();
  private volatile boolean closed;

  public MicrometerSweepMetrics(MeterRegistry registry) {
    this(registry, "ephemera");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "feed.ephemera"})
   */
  public MicrometerSweepMetrics(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    String base = namePrefix + ".sweep";
    this.registry = registry;
    this.itemsDeleted = Counter.builder(base + ".items.deleted")
        .description("Expired content items deleted")
        .register(registry);
    this.likesDeleted = Counter.builder(base + ".likes.deleted")
        .description("Like edges deleted with their items")
        .register(registry);
    this.commentsDeleted = Counter.builder(base + ".comments.deleted")
        .description("Comment edges deleted with their items")
        .register(registry);
    this.blobsDeleted = Counter.builder(base + ".blobs.deleted")
        .description("Media blobs deleted")
        .register(registry);
    this.orphansReclaimed = Counter.builder(base + ".orphans.reclaimed")
        .description("Engagement edges whose parent item no longer existed")
        .register(registry);
    this.errors = Counter.builder(base + ".errors")
        .description("Per-step sweep failures")
        .register(registry);
    for (SweepOutcome outcome : SweepOutcome.values()) {
      runs.put(outcome, Counter.builder(base + ".runs")
          .description("Sweeps by outcome")
          .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
          .register(registry));
    }
    this.duration = Timer.builder(base + ".duration")
        .description("Wall-clock time of one sweep")
        .register(registry);
    this.lastExpiredGauge = Gauge.builder(base + ".last.expired", lastExpired, AtomicInteger::get)
        .description("Expired items matched by the latest sweep")
        .register(registry);
  }

  @Override
  public void recordSweep(SweepResult result, Duration took) {
    if (closed) return;
    itemsDeleted.increment(result.deletedItems());
    likesDeleted.increment(result.deletedLikeEdges());
    commentsDeleted.increment(result.deletedCommentEdges());
    blobsDeleted.increment(result.deletedBlobs());
    orphansReclaimed.increment(result.reclaimedOrphanEdges());
    errors.increment(result.errors().size());
    runs.get(result.outcome()).increment();
    duration.record(took);
    lastExpired.set(result.expiredItems());
  }

  /**
   * Removes all meters registered by this instance from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(itemsDeleted, likesDeleted, commentsDeleted,
        blobsDeleted, orphansReclaimed, errors, duration, lastExpiredGauge));
    meters.addAll(runs.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
