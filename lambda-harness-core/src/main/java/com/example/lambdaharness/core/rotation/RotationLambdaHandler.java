package com.example.lambdaharness.core.rotation;

import com.example.lambdaharness.core.HarnessConfig;
import com.example.lambdaharness.core.LambdaHarnessHandler;
import com.example.lambdaharness.core.secrets.AwsSecretStore;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Lambda entry point for a rotation function. Subclasses pass their runner and shared state
 * factory; the store is an {@link AwsSecretStore} built from the environment.
 *
 * @param <S> shared state type
 * @param <T> typed shape of the secret payload
 */
public abstract class RotationLambdaHandler<S, T>
    extends LambdaHarnessHandler<S, RotationEvent, Void> {

  protected RotationLambdaHandler(
      final Function<HarnessConfig, RotationRunner<S, T>> runnerFactory,
      final Supplier<S> sharedState) {
    this(HarnessConfig.fromEnvironment(), runnerFactory, sharedState);
  }

  protected RotationLambdaHandler(
      final HarnessConfig config,
      final Function<HarnessConfig, RotationRunner<S, T>> runnerFactory,
      final Supplier<S> sharedState) {
    super(
        config,
        c -> RotationHandler.of(runnerFactory.apply(c), AwsSecretStore.create(c)),
        sharedState,
        RotationEvent.class);
  }
}
