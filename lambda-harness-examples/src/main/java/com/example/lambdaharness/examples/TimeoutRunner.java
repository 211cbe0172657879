package com.example.lambdaharness.examples;

import com.example.lambdaharness.core.InvocationContext;
import com.example.lambdaharness.core.LambdaHarnessHandler;
import com.example.lambdaharness.core.Runner;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.util.Optional;

/** Sleeps for as long as the event asks, to show the synthetic timeout. */
public final class TimeoutRunner implements Runner<Void, TimeoutRunner.Sleep, Void> {

  static final Duration DEFAULT_SLEEP = Duration.ofSeconds(60);

  /**
   * Event of the timeout function.
   *
   * @param timeoutSecs seconds to sleep; 60 when absent
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Sleep(@JsonProperty("timeout_secs") Long timeoutSecs) {

    Duration duration() {
      return Optional.ofNullable(timeoutSecs).map(Duration::ofSeconds).orElse(DEFAULT_SLEEP);
    }
  }

  @Override
  public Void run(final Void shared, final Sleep event, final InvocationContext context)
      throws InterruptedException {
    Thread.sleep(event.duration().toMillis());
    return null;
  }

  /** Lambda entry point. */
  public static final class Handler extends LambdaHarnessHandler<Void, Sleep, Void> {
    public Handler() {
      super(config -> new TimeoutRunner(), () -> null, Sleep.class);
    }
  }
}
