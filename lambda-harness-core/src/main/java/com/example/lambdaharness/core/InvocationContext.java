package com.example.lambdaharness.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable per-invocation metadata handed to the user work.
 *
 * @param region AWS region the function runs in
 * @param deadline absolute time the platform kills the invocation; empty in local test mode
 * @param requestId platform request id, if known
 */
public record InvocationContext(
    String region, Optional<Instant> deadline, Optional<String> requestId) {

  public InvocationContext {
    Objects.requireNonNull(region, "region");
    deadline = Optional.ofNullable(deadline).flatMap(d -> d);
    requestId = Optional.ofNullable(requestId).flatMap(r -> r);
  }

  /**
   * Context for a local invocation with no deadline.
   *
   * @param region AWS region
   * @return context
   */
  public static InvocationContext local(final String region) {
    return new InvocationContext(region, Optional.empty(), Optional.empty());
  }

  /**
   * Context for a hosted invocation.
   *
   * @param region AWS region
   * @param deadline absolute deadline
   * @param requestId platform request id, may be null
   * @return context
   */
  public static InvocationContext withDeadline(
      final String region, final Instant deadline, final String requestId) {
    return new InvocationContext(
        region, Optional.of(deadline), Optional.ofNullable(requestId));
  }

  /**
   * Time left until the deadline, never negative.
   *
   * @param clock wall clock
   * @return remaining time; empty when there is no deadline
   */
  public Optional<Duration> remainingTime(final Clock clock) {
    return deadline
        .map(d -> Duration.between(clock.instant(), d))
        .map(remaining -> remaining.isNegative() ? Duration.ZERO : remaining);
  }
}
