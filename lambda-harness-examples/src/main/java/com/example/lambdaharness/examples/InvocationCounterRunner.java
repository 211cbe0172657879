package com.example.lambdaharness.examples;

import com.example.lambdaharness.core.InvocationContext;
import com.example.lambdaharness.core.LambdaHarnessHandler;
import com.example.lambdaharness.core.Runner;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.atomic.AtomicLong;

/** Counts the invocations a warm environment has served. */
public final class InvocationCounterRunner implements Runner<AtomicLong, JsonNode, Long> {

  @Override
  public Long run(final AtomicLong invocations, final JsonNode event, final InvocationContext ctx) {
    return invocations.incrementAndGet();
  }

  /** Lambda entry point. */
  public static final class Handler extends LambdaHarnessHandler<AtomicLong, JsonNode, Long> {
    public Handler() {
      super(config -> new InvocationCounterRunner(), AtomicLong::new, JsonNode.class);
    }
  }
}
