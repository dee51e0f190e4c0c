package ephemera.sweep;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Threads for one sweep role, named {@code ephemera-sweep-<role>-<n>}.
 *
 * <p>Threads are daemons, so an unclosed sweeper never blocks JVM exit. A cascade that escapes
 * with an exception is logged at {@code SEVERE} with the thread name instead of going to stderr.
 */
final class SweepThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(SweepThreadFactory.class.getName());

  private final String namePrefix;
  private final AtomicInteger created = new AtomicInteger();

  SweepThreadFactory(String role) {
    Objects.requireNonNull(role, "role");
    if (role.isBlank()) {
      throw new IllegalArgumentException("role must not be blank");
    }
    this.namePrefix = "ephemera-sweep-" + role + "-";
  }

  @Override
  public Thread newThread(Runnable task) {
    Thread thread = new Thread(task, namePrefix + created.incrementAndGet());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(SweepThreadFactory::logUncaught);
    return thread;
  }

  private static void logUncaught(Thread thread, Throwable error) {
    logger.log(Level.SEVERE, "Uncaught exception in " + thread.getName(), error);
  }
}
