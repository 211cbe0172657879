package com.example.lambdaharness.core.rotation;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.lambdaharness.core.InvocationContext;
import com.example.lambdaharness.core.Runner;
import com.example.lambdaharness.core.secrets.SecretRecord;
import com.example.lambdaharness.core.secrets.SecretStore;
import com.example.lambdaharness.core.secrets.VersionStage;
import java.util.Objects;

/**
 * Drives a {@link RotationRunner} through the four rotation steps.
 *
 * <ul>
 *   <li>createSecret: writes a new pending version unless a pending version from this rotation
 *       already exists. A pending version sharing the current version id is a leftover and gets
 *       replaced.
 *   <li>setSecret: skipped when the pending secret already passes {@link RotationRunner#test}.
 *   <li>testSecret: fails the rotation when the pending secret doesn't work.
 *   <li>finishSecret: promotes pending to current, unless that already happened.
 * </ul>
 *
 * <p>Store calls run one after the other. Failures propagate unchanged.
 *
 * @param <S> shared state type
 * @param <T> typed shape of the secret payload
 */
public final class RotationHandler<S, T> implements Runner<S, RotationEvent, Void> {

  private static final System.Logger LOGGER = System.getLogger(RotationHandler.class.getName());

  private final RotationRunner<S, T> runner;
  private final SecretStore store;

  private RotationHandler(final RotationRunner<S, T> runner, final SecretStore store) {
    this.runner = Objects.requireNonNull(runner, "runner");
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Wraps a rotation runner.
   *
   * @param runner user rotation logic
   * @param store secret store the versions are read from and written to
   * @param <S> shared state type
   * @param <T> typed shape of the secret payload
   * @return handler usable with {@link com.example.lambdaharness.core.Harness}
   */
  public static <S, T> RotationHandler<S, T> of(
      final RotationRunner<S, T> runner, final SecretStore store) {
    return new RotationHandler<>(runner, store);
  }

  @Override
  public void setup() throws Exception {
    runner.setup();
  }

  @Override
  public Void run(final S shared, final RotationEvent event, final InvocationContext context)
      throws Exception {
    LOGGER.log(INFO, "Running {0} for secret {1}", event.step(), event.secretId());
    switch (event.step()) {
      case CREATE -> create(shared, event, context);
      case SET -> set(shared, event, context);
      case TEST -> test(shared, event, context);
      case FINISH -> finish(shared, event, context);
    }
    return null;
  }

  private void create(final S shared, final RotationEvent event, final InvocationContext context)
      throws Exception {
    final var current = fetch(event, VersionStage.CURRENT);
    final var pending = store.find(event.secretId(), VersionStage.PENDING, runner.secretType());

    final var stale =
        pending.map(p -> p.versionId().equals(current.versionId())).orElse(Boolean.TRUE);
    if (!stale) {
      LOGGER.log(
          INFO,
          "Found existing pending value {0} for secret {1}",
          pending.get().versionId(),
          event.secretId());
      return;
    }

    final var candidate = runner.create(shared, current.container(), store, context);
    store.writePending(event.secretId(), event.clientRequestToken(), candidate);
    LOGGER.log(INFO, "Created pending value for secret {0}", event.secretId());
  }

  private void set(final S shared, final RotationEvent event, final InvocationContext context)
      throws Exception {
    final var pending = fetch(event, VersionStage.PENDING);
    try {
      runner.test(shared, pending.container(), context);
      LOGGER.log(INFO, "Pending value of secret {0} is already set", event.secretId());
      return;
    } catch (final Exception e) {
      LOGGER.log(
          WARNING,
          "Pending value of secret {0} does not work yet, setting it: {1}",
          event.secretId(),
          e.toString());
    }

    final var current = fetch(event, VersionStage.CURRENT);
    runner.set(shared, current.container(), pending.container(), context);
    LOGGER.log(INFO, "Set pending value of secret {0}", event.secretId());
  }

  private void test(final S shared, final RotationEvent event, final InvocationContext context)
      throws Exception {
    final var pending = fetch(event, VersionStage.PENDING);
    runner.test(shared, pending.container(), context);
    LOGGER.log(INFO, "Pending value of secret {0} passed the test", event.secretId());
  }

  private void finish(final S shared, final RotationEvent event, final InvocationContext context)
      throws Exception {
    final var current = fetch(event, VersionStage.CURRENT);
    final var pending = fetch(event, VersionStage.PENDING);
    if (current.versionId().equals(pending.versionId())) {
      LOGGER.log(
          INFO,
          "Version {0} of secret {1} is already current",
          current.versionId(),
          event.secretId());
      return;
    }

    runner.finish(shared, current.container(), pending.container(), context);
    store.promote(current.arn(), current.versionId(), pending.versionId());
  }

  private SecretRecord<T> fetch(final RotationEvent event, final VersionStage stage) {
    return store.fetch(event.secretId(), stage, runner.secretType());
  }
}
