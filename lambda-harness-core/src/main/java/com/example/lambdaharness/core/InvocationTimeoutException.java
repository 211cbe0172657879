package com.example.lambdaharness.core;

import java.time.Instant;

/**
 * Synthetic failure produced when the deadline watcher wins the race against the user work.
 *
 * <p>Kept distinct from functional failures so that failure routing can tell "ran out of time"
 * apart from "logic rejected the input".
 */
public class InvocationTimeoutException extends RuntimeException {

  private final Instant deadline;

  public InvocationTimeoutException(final Instant deadline) {
    super("Lambda failed by running into a timeout (deadline %s)".formatted(deadline));
    this.deadline = deadline;
  }

  public Instant deadline() {
    return deadline;
  }
}
