package com.example.lambdaharness.core;

import com.example.lambdaharness.core.secrets.ThrottleRetry;
import java.net.URI;
import java.util.Optional;
import java.util.function.UnaryOperator;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;

/**
 * Process-level configuration of the harness.
 *
 * <p>Values are resolved from system properties first and environment variables second:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION (required)
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID
 *   <li>aws.secretAccessKey / AWS_SECRET_ACCESS_KEY
 *   <li>harness.throttle.maxAttempts / HARNESS_THROTTLE_MAX_ATTEMPTS (optional, 0 = unbounded)
 * </ul>
 *
 * @param region AWS region the secret store client talks to
 * @param secretsManagerEndpoint optional endpoint override
 * @param credentials optional static credentials; the default provider chain is used otherwise
 * @param throttlePolicy retry policy applied to throttled secret store requests
 */
public record HarnessConfig(
    String region,
    Optional<URI> secretsManagerEndpoint,
    Optional<AwsBasicCredentials> credentials,
    ThrottleRetry.Policy throttlePolicy) {

  private static final String THROTTLE_VARIABLE = "HARNESS_THROTTLE_MAX_ATTEMPTS";

  public HarnessConfig {
    if (region == null || region.isBlank()) {
      throw new ConfigurationException("Missing AWS_REGION env variable");
    }
    secretsManagerEndpoint = Optional.ofNullable(secretsManagerEndpoint).flatMap(e -> e);
    credentials = Optional.ofNullable(credentials).flatMap(c -> c);
    throttlePolicy = Optional.ofNullable(throttlePolicy).orElse(ThrottleRetry.Policy.DEFAULT);
  }

  /**
   * Minimal configuration for the given region with default endpoint, credentials and throttling.
   *
   * @param region AWS region
   * @return configuration
   */
  public static HarnessConfig of(final String region) {
    return new HarnessConfig(region, Optional.empty(), Optional.empty(), null);
  }

  /**
   * Resolves the configuration from system properties and the process environment.
   *
   * @return configuration
   * @throws ConfigurationException if no region is available
   */
  public static HarnessConfig fromEnvironment() {
    return resolve(System::getProperty, System::getenv);
  }

  static HarnessConfig resolve(
      final UnaryOperator<String> properties, final UnaryOperator<String> environment) {
    final var region = lookup(properties, environment, "aws.region", "AWS_REGION");

    final var endpoint =
        lookup(properties, environment, "aws.sm.endpoint", "AWS_SM_ENDPOINT").map(URI::create);

    final var credentials =
        lookup(properties, environment, "aws.accessKeyId", "AWS_ACCESS_KEY_ID")
            .flatMap(
                accessKey ->
                    lookup(properties, environment, "aws.secretAccessKey", "AWS_SECRET_ACCESS_KEY")
                        .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)));

    final var throttlePolicy =
        lookup(properties, environment, "harness.throttle.maxAttempts", THROTTLE_VARIABLE)
            .map(HarnessConfig::parseAttempts)
            .map(HarnessConfig::policyFor)
            .orElse(ThrottleRetry.Policy.DEFAULT);

    return new HarnessConfig(region.orElse(null), endpoint, credentials, throttlePolicy);
  }

  private static Optional<String> lookup(
      final UnaryOperator<String> properties,
      final UnaryOperator<String> environment,
      final String property,
      final String variable) {
    return Optional.ofNullable(properties.apply(property))
        .or(() -> Optional.ofNullable(environment.apply(variable)))
        .map(String::trim)
        .filter(value -> !value.isEmpty());
  }

  private static ThrottleRetry.Policy policyFor(final int attempts) {
    final var initialDelay = ThrottleRetry.Policy.DEFAULT.initialDelayMillis();
    return attempts == 0
        ? ThrottleRetry.Policy.unbounded(initialDelay)
        : ThrottleRetry.Policy.exponential(attempts, initialDelay);
  }

  private static int parseAttempts(final String value) {
    try {
      final var attempts = Integer.parseInt(value);
      if (attempts < 0) {
        throw new ConfigurationException("Throttle max attempts must be >= 0, got " + value);
      }
      return attempts;
    } catch (final NumberFormatException e) {
      throw new ConfigurationException("Throttle max attempts is not a number: " + value, e);
    }
  }
}
