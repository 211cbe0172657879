package com.example.lambdaharness.core;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestStreamHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Clock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Adapts a {@link Runner} to the AWS Lambda Java runtime.
 *
 * <p>The runtime creates one handler instance per execution environment, so the {@link Harness}
 * built here, including its shared state, lives as long as the environment stays warm. Each
 * request's deadline is derived from {@link Context#getRemainingTimeInMillis()}.
 *
 * <pre>{@code
 * public final class Handler extends LambdaHarnessHandler<Void, MyEvent, MyResult> {
 *   public Handler() {
 *     super(config -> new MyRunner(), () -> null, MyEvent.class);
 *   }
 * }
 * }</pre>
 *
 * @param <S> shared state type
 * @param <E> event type
 * @param <R> return type
 */
public abstract class LambdaHarnessHandler<S, E, R> implements RequestStreamHandler {

  private final HarnessConfig config;
  private final Harness<S, E, R> harness;
  private final Class<E> eventType;
  private final ObjectMapper mapper;
  private final Clock clock;

  protected LambdaHarnessHandler(
      final Function<HarnessConfig, ? extends Runner<S, E, R>> runnerFactory,
      final Supplier<S> sharedState,
      final Class<E> eventType) {
    this(HarnessConfig.fromEnvironment(), runnerFactory, sharedState, eventType);
  }

  protected LambdaHarnessHandler(
      final HarnessConfig config,
      final Function<HarnessConfig, ? extends Runner<S, E, R>> runnerFactory,
      final Supplier<S> sharedState,
      final Class<E> eventType) {
    this(config, runnerFactory, sharedState, eventType, new ObjectMapper(), Clock.systemUTC());
  }

  LambdaHarnessHandler(
      final HarnessConfig config,
      final Function<HarnessConfig, ? extends Runner<S, E, R>> runnerFactory,
      final Supplier<S> sharedState,
      final Class<E> eventType,
      final ObjectMapper mapper,
      final Clock clock) {
    this.config = config;
    this.eventType = eventType;
    this.mapper = mapper;
    this.clock = clock;
    final Runner<S, E, R> runner = runnerFactory.apply(config);
    this.harness = Harness.builder(runner).sharedState(sharedState).build();
  }

  @Override
  public void handleRequest(final InputStream input, final OutputStream output, final Context ctx)
      throws IOException {
    final var event = mapper.readValue(input, eventType);
    final var deadline = clock.instant().plusMillis(ctx.getRemainingTimeInMillis());
    final var context =
        InvocationContext.withDeadline(config.region(), deadline, ctx.getAwsRequestId());

    final R result;
    try {
      result = harness.invoke(event, context);
    } catch (final RuntimeException | IOException e) {
      throw e;
    } catch (final Exception e) {
      throw new InvocationFailedException(e);
    }
    mapper.writeValue(output, result);
  }

  /**
   * Harness backing this handler.
   *
   * @return the harness
   */
  protected Harness<S, E, R> harness() {
    return harness;
  }
}
