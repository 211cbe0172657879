package com.example.lambdaharness.core.secrets;

import com.example.lambdaharness.core.HarnessConfig;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;

/** Builds {@link SecretsManagerClient} instances from a {@link HarnessConfig}. */
public final class SecretsManagerClients {

  private SecretsManagerClients() {}

  /**
   * Builds the client honoring region, endpoint and credentials overrides.
   *
   * <p>The SDK's own retries are switched off: {@link ThrottleRetry} is the only retry layer, so
   * its policy alone decides how long a throttled request may keep an invocation busy.
   *
   * @param config harness configuration
   * @return configured {@link SecretsManagerClient}
   */
  public static SecretsManagerClient create(final HarnessConfig config) {
    final var builder =
        SecretsManagerClient.builder()
            .region(Region.of(config.region()))
            .overrideConfiguration(o -> o.retryPolicy(RetryPolicy.none()));

    // Endpoint override (useful for Localstack in tests)
    config.secretsManagerEndpoint().ifPresent(builder::endpointOverride);

    config
        .credentials()
        .map(StaticCredentialsProvider::create)
        .ifPresentOrElse(
            builder::credentialsProvider,
            () -> builder.credentialsProvider(DefaultCredentialsProvider.builder().build()));

    return builder.build();
  }
}
