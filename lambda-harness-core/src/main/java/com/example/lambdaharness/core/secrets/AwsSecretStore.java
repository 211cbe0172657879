package com.example.lambdaharness.core.secrets;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.lambdaharness.core.HarnessConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.util.Optional;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetRandomPasswordRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;
import software.amazon.awssdk.services.secretsmanager.model.UpdateSecretVersionStageRequest;

/** {@link SecretStore} backed by AWS Secrets Manager through the AWS SDK for Java v2. */
public final class AwsSecretStore implements SecretStore {

  private static final System.Logger LOGGER = System.getLogger(AwsSecretStore.class.getName());

  private static final String GET_SECRET_VALUE = "GetSecretValue";
  private static final String GET_RANDOM_PASSWORD = "GetRandomPassword";
  private static final String PUT_SECRET_VALUE = "PutSecretValue";
  private static final String UPDATE_SECRET_VERSION_STAGE = "UpdateSecretVersionStage";

  private final SecretsManagerClient client;
  private final SecretCodec codec;
  private final ThrottleRetry.Policy throttlePolicy;

  public AwsSecretStore(final SecretsManagerClient client) {
    this(client, new SecretCodec(), ThrottleRetry.Policy.DEFAULT);
  }

  public AwsSecretStore(
      final SecretsManagerClient client,
      final SecretCodec codec,
      final ThrottleRetry.Policy throttlePolicy) {
    this.client = client;
    this.codec = codec;
    this.throttlePolicy = throttlePolicy;
  }

  /**
   * Builds a store whose client honors the region, endpoint, credentials and throttle settings of
   * the given configuration.
   *
   * @param config harness configuration
   * @return the store
   */
  public static AwsSecretStore create(final HarnessConfig config) {
    return new AwsSecretStore(
        SecretsManagerClients.create(config), new SecretCodec(), config.throttlePolicy());
  }

  @Override
  public <T> SecretRecord<T> fetch(
      final String secretId, final VersionStage stage, final Class<T> type) {
    try {
      return toRecord(secretId, getSecretValue(secretId, stage), type);
    } catch (final SdkException e) {
      throw new SecretStoreException(
          GET_SECRET_VALUE, secretId, "Unable to fetch %s value".formatted(stage.label()), e);
    }
  }

  @Override
  public <T> Optional<SecretRecord<T>> find(
      final String secretId, final VersionStage stage, final Class<T> type) {
    try {
      return Optional.of(toRecord(secretId, getSecretValue(secretId, stage), type));
    } catch (final ResourceNotFoundException e) {
      LOGGER.log(DEBUG, "No {0} version for secret {1}", stage.label(), secretId);
      return Optional.empty();
    } catch (final SdkException e) {
      throw new SecretStoreException(
          GET_SECRET_VALUE, secretId, "Unable to fetch %s value".formatted(stage.label()), e);
    }
  }

  @Override
  public String generatePassword(final boolean excludePunctuation, final long length) {
    final var builder =
        GetRandomPasswordRequest.builder()
            .excludeCharacters("\"")
            .excludePunctuation(excludePunctuation);
    if (length > 0) builder.passwordLength(length);
    final var request = builder.build();

    try {
      final var response =
          ThrottleRetry.run(
              GET_RANDOM_PASSWORD, () -> client.getRandomPassword(request), throttlePolicy);
      return Optional.ofNullable(response.randomPassword())
          .filter(password -> !password.isEmpty())
          .orElseThrow(
              () ->
                  new SecretStoreException(
                      GET_RANDOM_PASSWORD, null, "Generated password is empty"));
    } catch (final SdkException e) {
      throw new SecretStoreException(
          GET_RANDOM_PASSWORD, null, "Unable to generate new password", e);
    }
  }

  @Override
  public void writePending(
      final String secretId, final String requestToken, final SecretContainer<?> container) {
    final String secretString;
    try {
      secretString = codec.serialize(container);
    } catch (final JsonProcessingException e) {
      throw new SecretStoreException(
          PUT_SECRET_VALUE, secretId, "Unable to serialize secret value", e);
    }

    final var request =
        PutSecretValueRequest.builder()
            .secretId(secretId)
            .clientRequestToken(requestToken)
            .secretString(secretString)
            .versionStages(VersionStage.PENDING.label())
            .build();
    try {
      final var response =
          ThrottleRetry.run(PUT_SECRET_VALUE, () -> client.putSecretValue(request), throttlePolicy);
      LOGGER.log(
          INFO,
          "Wrote {0} version {1} of {2}",
          VersionStage.PENDING.label(),
          response.versionId(),
          secretId);
    } catch (final SdkException e) {
      throw new SecretStoreException(
          PUT_SECRET_VALUE,
          secretId,
          "Unable to push new secret value to " + VersionStage.PENDING.label(),
          e);
    }
  }

  @Override
  public void promote(
      final String arn, final String currentVersionId, final String pendingVersionId) {
    final var request =
        UpdateSecretVersionStageRequest.builder()
            .secretId(arn)
            .versionStage(VersionStage.CURRENT.label())
            .moveToVersionId(pendingVersionId)
            .removeFromVersionId(currentVersionId)
            .build();
    try {
      ThrottleRetry.run(
          UPDATE_SECRET_VERSION_STAGE,
          () -> client.updateSecretVersionStage(request),
          throttlePolicy);
      LOGGER.log(
          INFO,
          "Moved {0} from version {1} to {2} of {3}",
          VersionStage.CURRENT.label(),
          currentVersionId,
          pendingVersionId,
          arn);
    } catch (final SdkException e) {
      throw new SecretStoreException(
          UPDATE_SECRET_VERSION_STAGE,
          arn,
          "Unable to move %s to version %s"
              .formatted(VersionStage.CURRENT.label(), pendingVersionId),
          e);
    }
  }

  private GetSecretValueResponse getSecretValue(final String secretId, final VersionStage stage) {
    final var request =
        GetSecretValueRequest.builder().secretId(secretId).versionStage(stage.label()).build();
    return ThrottleRetry.run(
        GET_SECRET_VALUE, () -> client.getSecretValue(request), throttlePolicy);
  }

  private <T> SecretRecord<T> toRecord(
      final String secretId, final GetSecretValueResponse response, final Class<T> type) {
    final var arn =
        Optional.ofNullable(response.arn())
            .filter(value -> !value.isEmpty())
            .orElseThrow(() -> invalid(secretId, "Arn is unavailable for secret value"));
    final var versionId =
        Optional.ofNullable(response.versionId())
            .filter(value -> !value.isEmpty())
            .orElseThrow(() -> invalid(secretId, "Version id is unavailable for secret value"));

    try {
      final SecretContainer<T> container;
      if (response.secretString() != null) {
        container = codec.parse(response.secretString(), type);
      } else if (response.secretBinary() != null) {
        container = codec.parse(response.secretBinary().asByteArray(), type);
      } else {
        throw invalid(secretId, "Neither secret string nor secret binary is set");
      }
      return new SecretRecord<>(arn, versionId, container);
    } catch (final IOException e) {
      throw new SecretStoreException(
          GET_SECRET_VALUE,
          secretId,
          "Unable to parse secret value, value does not conform to " + type.getSimpleName(),
          e);
    }
  }

  private static SecretStoreException invalid(final String secretId, final String message) {
    return new SecretStoreException(GET_SECRET_VALUE, secretId, message);
  }
}
