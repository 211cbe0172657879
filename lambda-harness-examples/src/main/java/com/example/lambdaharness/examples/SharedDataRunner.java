package com.example.lambdaharness.examples;

import com.example.lambdaharness.core.InvocationContext;
import com.example.lambdaharness.core.LambdaHarnessHandler;
import com.example.lambdaharness.core.Runner;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tells whether the {@code test} attribute equals the one of the previous invocation in the same
 * environment. The previous value lives in the shared state, so a cold start forgets it.
 */
public final class SharedDataRunner
    implements Runner<AtomicReference<String>, JsonNode, SharedDataRunner.Comparison> {

  /**
   * Result of a comparison.
   *
   * @param matchesPrev whether the attribute equals the previous invocation's
   */
  public record Comparison(@JsonProperty("matches_prev") boolean matchesPrev) {}

  @Override
  public Comparison run(
      final AtomicReference<String> previous,
      final JsonNode event,
      final InvocationContext context) {
    final var value =
        Optional.ofNullable(event.get("test"))
            .filter(JsonNode::isTextual)
            .map(JsonNode::asText)
            .orElse(null);
    return new Comparison(Objects.equals(value, previous.getAndSet(value)));
  }

  /** Lambda entry point. */
  public static final class Handler
      extends LambdaHarnessHandler<AtomicReference<String>, JsonNode, Comparison> {
    public Handler() {
      super(config -> new SharedDataRunner(), AtomicReference::new, JsonNode.class);
    }
  }
}
