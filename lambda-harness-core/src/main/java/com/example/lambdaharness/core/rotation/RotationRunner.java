package com.example.lambdaharness.core.rotation;

import com.example.lambdaharness.core.InvocationContext;
import com.example.lambdaharness.core.secrets.SecretContainer;
import com.example.lambdaharness.core.secrets.SecretStore;

/**
 * User side of a secret rotation. Each method maps to one step of the protocol; {@link
 * RotationHandler} reads and writes the secret versions around them.
 *
 * <p>Every step may be re-invoked after a partial failure, so implementations must tolerate
 * running twice with the same input.
 *
 * @param <S> shared state type
 * @param <T> typed shape of the secret payload
 */
public interface RotationRunner<S, T> {

  /**
   * Typed shape the secret payload is parsed into.
   *
   * @return payload class
   */
  Class<T> secretType();

  /**
   * Called once before the first invocation.
   *
   * @throws Exception if the runner cannot be used
   */
  default void setup() throws Exception {}

  /**
   * Derives the candidate secret from the current one, typically with a password from {@link
   * SecretStore#generatePassword(boolean)}. Use {@link SecretContainer#withData} to keep the
   * fields {@code T} doesn't model.
   *
   * @param shared shared state
   * @param current current secret
   * @param store secret store
   * @param context invocation metadata
   * @return the candidate, written as the pending version
   * @throws Exception on failure
   */
  SecretContainer<T> create(
      S shared, SecretContainer<T> current, SecretStore store, InvocationContext context)
      throws Exception;

  /**
   * Applies the pending secret to the protected resource, authenticating with the current one.
   *
   * @param shared shared state
   * @param current current secret
   * @param pending pending secret
   * @param context invocation metadata
   * @throws Exception on failure
   */
  void set(
      S shared, SecretContainer<T> current, SecretContainer<T> pending, InvocationContext context)
      throws Exception;

  /**
   * Checks that the pending secret grants access to the resource.
   *
   * @param shared shared state
   * @param pending pending secret
   * @param context invocation metadata
   * @throws Exception if the secret doesn't work
   */
  void test(S shared, SecretContainer<T> pending, InvocationContext context) throws Exception;

  /**
   * Runs right before the pending version is promoted to current. No-op by default.
   *
   * @param shared shared state
   * @param current current secret
   * @param pending pending secret
   * @param context invocation metadata
   * @throws Exception on failure; the promotion is then skipped
   */
  default void finish(
      final S shared,
      final SecretContainer<T> current,
      final SecretContainer<T> pending,
      final InvocationContext context)
      throws Exception {}
}
