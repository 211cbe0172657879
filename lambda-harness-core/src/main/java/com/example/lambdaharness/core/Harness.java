package com.example.lambdaharness.core;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Runs a {@link Runner} per invocation and races it against the invocation deadline.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var harness = Harness.builder(new MyRunner())
 *     .sharedState(MyShared::new)
 *     .build();
 *
 * var result = harness.invoke(event, InvocationContext.withDeadline(region, deadline, requestId));
 * }</pre>
 *
 * <h2>Timeouts</h2>
 *
 * <p>When the context carries a deadline, a watcher wakes {@link DeadlineScheduler#SAFETY_MARGIN}
 * before it. If the watcher finishes first the invocation fails with {@link
 * InvocationTimeoutException}, turning a silent platform kill into an error that on-failure
 * destinations can see. The work itself is not interrupted, it is only no longer waited for: store
 * calls it has started may still complete. Without a deadline (local test mode) no watcher runs.
 *
 * <h2>Shared State</h2>
 *
 * <p>The shared state factory runs exactly once, when the harness is built. The same instance is
 * handed to every invocation for the lifetime of the harness.
 *
 * @param <S> shared state type
 * @param <E> event type
 * @param <R> return type
 */
public final class Harness<S, E, R> implements AutoCloseable {

  private static final System.Logger LOGGER = System.getLogger(Harness.class.getName());

  private final Runner<S, E, R> runner;
  private final S shared;
  private final ExecutorService executor;
  private final DeadlineScheduler scheduler;

  private Harness(final Builder<S, E, R> builder) {
    this.runner = builder.runner;
    this.executor = builder.executor;
    this.scheduler = builder.scheduler;
    this.shared = builder.sharedState.get();
  }

  /**
   * Creates a new builder for the given runner.
   *
   * @param runner work executed on every invocation
   * @param <S> shared state type
   * @param <E> event type
   * @param <R> return type
   * @return new builder
   */
  public static <S, E, R> Builder<S, E, R> builder(final Runner<S, E, R> runner) {
    return new Builder<>(runner);
  }

  /** Builder for {@link Harness} instances. */
  public static final class Builder<S, E, R> {
    private final Runner<S, E, R> runner;
    private Supplier<S> sharedState = () -> null;
    private ExecutorService executor;
    private DeadlineScheduler scheduler;

    private Builder(final Runner<S, E, R> runner) {
      this.runner = runner;
    }

    /**
     * Sets the factory of the shared state. It is called once, by {@link #build()}.
     *
     * <p>Default: {@code null} shared state
     *
     * @param sharedState shared state factory
     * @return this builder
     */
    public Builder<S, E, R> sharedState(final Supplier<S> sharedState) {
      this.sharedState = sharedState;
      return this;
    }

    /**
     * Sets the executor the work runs on. Abandoned work keeps its thread until it finishes, so
     * the executor must not be bounded to a single thread.
     *
     * <p>Default: cached pool of daemon threads
     *
     * @param executor work executor
     * @return this builder
     */
    public Builder<S, E, R> executor(final ExecutorService executor) {
      this.executor = executor;
      return this;
    }

    /**
     * Sets the deadline scheduler.
     *
     * @param scheduler deadline scheduler
     * @return this builder
     */
    public Builder<S, E, R> scheduler(final DeadlineScheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /**
     * Validates the configuration, runs {@link Runner#setup()} and creates the shared state.
     *
     * @return the harness
     * @throws IllegalStateException if the runner or shared state factory is missing
     * @throws ConfigurationException if runner setup fails
     */
    public Harness<S, E, R> build() {
      if (runner == null) throw new IllegalStateException("runner is required");
      if (sharedState == null) throw new IllegalStateException("sharedState is required");
      if (executor == null) {
        executor =
            Executors.newCachedThreadPool(
                r -> {
                  var t = new Thread(r, "lambda-harness-worker");
                  t.setDaemon(true);
                  return t;
                });
      }
      if (scheduler == null) scheduler = new DeadlineScheduler();

      try {
        runner.setup();
      } catch (final Exception e) {
        throw new ConfigurationException("Runner setup failed", e);
      }
      LOGGER.log(INFO, "Starting lambda runtime");
      return new Harness<>(this);
    }
  }

  /**
   * Runs one invocation.
   *
   * @param event the received event
   * @param context invocation metadata
   * @return the work's result
   * @throws InvocationTimeoutException if the deadline watcher won the race
   * @throws Exception the work's own failure, unchanged
   */
  public R invoke(final E event, final InvocationContext context) throws Exception {
    LOGGER.log(INFO, "Received lambda invocation with event: {0}", event);

    final var outcome = new CompletableFuture<R>();

    final var watcher =
        context
            .deadline()
            .map(
                deadline -> {
                  final var wake = scheduler.sleepUntil(deadline.toEpochMilli());
                  wake.thenRun(
                      () -> {
                        final var timeout = new InvocationTimeoutException(deadline);
                        if (outcome.completeExceptionally(timeout)) {
                          LOGGER.log(ERROR, "Lambda invocation timed out", timeout);
                        }
                      });
                  return wake;
                });

    try {
      executor.execute(
          () -> {
            try {
              final var result = runner.run(shared, event, context);
              if (outcome.complete(result)) {
                LOGGER.log(INFO, "Completed lambda invocation with result: {0}", result);
              }
            } catch (final Exception e) {
              if (outcome.completeExceptionally(e)) {
                LOGGER.log(ERROR, "Lambda invocation failed", e);
              }
            } catch (final Error e) {
              outcome.completeExceptionally(e);
              throw e;
            }
          });

      return outcome.get();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw e;
    } catch (final ExecutionException e) {
      final var cause = e.getCause();
      if (cause instanceof Exception exception) throw exception;
      if (cause instanceof Error error) throw error;
      throw e;
    } finally {
      watcher.ifPresent(w -> w.cancel(false));
    }
  }

  /**
   * Shared state of this harness.
   *
   * @return shared state, possibly null
   */
  public S shared() {
    return shared;
  }

  @Override
  public void close() {
    executor.shutdownNow();
    scheduler.close();
  }
}
