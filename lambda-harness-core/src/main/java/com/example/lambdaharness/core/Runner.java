package com.example.lambdaharness.core;

/**
 * Work executed by the {@link Harness} on every invocation.
 *
 * <p>{@code shared} is created once per harness, i.e. once per warm execution environment, and
 * handed to every invocation. The platform never runs two invocations of one environment at the
 * same time, but the harness runs work on pool threads: mutable shared state must use
 * thread-safe holders ({@code Atomic*}, locks). Reuse across invocations is never guaranteed.
 *
 * @param <S> shared state type
 * @param <E> event type
 * @param <R> return type
 */
public interface Runner<S, E, R> {

  /**
   * Called once before the first invocation, never per invocation. Keep it short, it delays
   * startup.
   *
   * @throws Exception if the runner cannot be used
   */
  default void setup() throws Exception {}

  /**
   * Handles one invocation.
   *
   * @param shared state shared between invocations of this environment
   * @param event the received event
   * @param context invocation metadata
   * @return the invocation result
   * @throws Exception any failure; it becomes the invocation's result unchanged
   */
  R run(S shared, E event, InvocationContext context) throws Exception;
}
