package com.example.lambdaharness.examples;

import static java.lang.System.Logger.Level.INFO;

import com.example.lambdaharness.core.InvocationContext;
import com.example.lambdaharness.core.LambdaHarnessHandler;
import com.example.lambdaharness.core.Runner;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/** Answers with the {@code test} attribute of the event, or {@code "none"} without one. */
public final class EchoRunner implements Runner<Void, JsonNode, EchoRunner.Echo> {

  private static final System.Logger LOGGER = System.getLogger(EchoRunner.class.getName());

  /**
   * Result of an echo invocation.
   *
   * @param data echoed attribute
   */
  public record Echo(String data) {}

  @Override
  public Echo run(final Void shared, final JsonNode event, final InvocationContext context) {
    LOGGER.log(INFO, "Echoing event {0}", event);
    return new Echo(
        Optional.ofNullable(event.get("test"))
            .filter(JsonNode::isTextual)
            .map(JsonNode::asText)
            .orElse("none"));
  }

  /** Lambda entry point. */
  public static final class Handler extends LambdaHarnessHandler<Void, JsonNode, Echo> {
    public Handler() {
      super(config -> new EchoRunner(), () -> null, JsonNode.class);
    }
  }
}
