package com.example.lambdaharness.core;

import static java.lang.System.Logger.Level.DEBUG;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Wakes up shortly before an absolute deadline.
 *
 * <p>The deadline is converted once into a monotonic target, from one wall-clock sample and one
 * {@link System#nanoTime()} sample, so wall-clock adjustments after scheduling don't move the wake
 * time. Firing is best effort: the timer thread has to be scheduled by the host to run.
 */
public final class DeadlineScheduler implements AutoCloseable {

  /** Lead time subtracted from the deadline so the synthetic timeout beats the platform kill. */
  public static final Duration SAFETY_MARGIN = Duration.ofMillis(100);

  private static final System.Logger LOGGER = System.getLogger(DeadlineScheduler.class.getName());

  private final Clock clock;
  private final LongSupplier nanoTime;
  private final ScheduledThreadPoolExecutor timer;

  public DeadlineScheduler() {
    this(Clock.systemUTC(), System::nanoTime);
  }

  DeadlineScheduler(final Clock clock, final LongSupplier nanoTime) {
    this.clock = clock;
    this.nanoTime = nanoTime;
    this.timer =
        new ScheduledThreadPoolExecutor(
            1,
            r -> {
              var t = new Thread(r, "lambda-harness-deadline");
              t.setDaemon(true);
              return t;
            });
    // a cancelled watcher must not stay queued until its deadline
    this.timer.setRemoveOnCancelPolicy(true);
  }

  /**
   * Time to sleep for the given deadline: {@code deadline - now - SAFETY_MARGIN}, saturated at
   * zero.
   *
   * @param deadlineEpochMillis absolute deadline in epoch milliseconds
   * @return non-negative delay
   */
  public Duration wakeDelay(final long deadlineEpochMillis) {
    final var remaining = deadlineEpochMillis - clock.millis() - SAFETY_MARGIN.toMillis();
    return Duration.ofMillis(Math.max(0L, remaining));
  }

  /**
   * Returns a future that completes at the wake time of the given deadline, or right away when
   * that time has already passed. Cancelling the future cancels the timer.
   *
   * @param deadlineEpochMillis absolute deadline in epoch milliseconds
   * @return future completing at the wake time
   */
  public CompletableFuture<Void> sleepUntil(final long deadlineEpochMillis) {
    final var startNanos = nanoTime.getAsLong();
    final var wakeNanos =
        TimeUnit.MILLISECONDS.toNanos(wakeDelay(deadlineEpochMillis).toMillis());
    final var delayNanos = Math.max(0L, wakeNanos - (nanoTime.getAsLong() - startNanos));

    LOGGER.log(
        DEBUG, "Setting deadline to {0} ms from now", TimeUnit.NANOSECONDS.toMillis(delayNanos));

    final var wake = new CompletableFuture<Void>();
    if (delayNanos == 0L) {
      wake.complete(null);
      return wake;
    }

    final var scheduled =
        timer.schedule(() -> wake.complete(null), delayNanos, TimeUnit.NANOSECONDS);
    wake.whenComplete(
        (ignored, error) -> {
          if (wake.isCancelled()) scheduled.cancel(false);
        });
    return wake;
  }

  int pendingTimers() {
    return timer.getQueue().size();
  }

  @Override
  public void close() {
    timer.shutdownNow();
  }
}
