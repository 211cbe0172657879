package com.example.lambdaharness.core.secrets;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetRandomPasswordRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetRandomPasswordResponse;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.InvalidParameterException;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ResourceExistsException;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;
import software.amazon.awssdk.services.secretsmanager.model.SecretsManagerException;
import software.amazon.awssdk.services.secretsmanager.model.UpdateSecretVersionStageRequest;
import software.amazon.awssdk.services.secretsmanager.model.UpdateSecretVersionStageResponse;

/**
 * Single-secret Secrets Manager held in memory, exposed through a Mockito-backed {@link
 * SecretsManagerClient}. Version staging follows the service: labels move between versions, a
 * client request token becomes the version id, and promoting a version leaves the pending label
 * in place.
 */
public final class InMemorySecretsManager {

  public static final String ARN_PREFIX =
      "arn:aws:secretsmanager:eu-central-1:000000000000:secret:";

  private final String secretId;
  private final Map<String, Version> versions = new LinkedHashMap<>();
  private final List<String> calls = new ArrayList<>();
  private final List<GetRandomPasswordRequest> passwordRequests = new ArrayList<>();
  private final AtomicInteger generated = new AtomicInteger();
  private int throttled;

  private record Version(String secretString, Set<String> stages) {}

  public InMemorySecretsManager(
      final String secretId, final String currentVersionId, final String currentValue) {
    this.secretId = secretId;
    putVersion(currentVersionId, currentValue, VersionStage.CURRENT.label());
  }

  public String arn() {
    return ARN_PREFIX + secretId;
  }

  /** Adds or replaces a version and moves the given labels onto it. */
  public synchronized void putVersion(
      final String versionId, final String value, final String... stages) {
    versions.put(versionId, new Version(value, new LinkedHashSet<>()));
    for (final var stage : stages) moveStage(stage, versionId);
  }

  public synchronized Optional<String> versionWith(final String stage) {
    return versions.entrySet().stream()
        .filter(e -> e.getValue().stages().contains(stage))
        .map(Map.Entry::getKey)
        .findFirst();
  }

  public synchronized String value(final String versionId) {
    return versions.get(versionId).secretString();
  }

  public synchronized Set<String> stages(final String versionId) {
    return Set.copyOf(versions.get(versionId).stages());
  }

  public synchronized int versionCount() {
    return versions.size();
  }

  /** Operation names in call order, throttled attempts included. */
  public synchronized List<String> calls() {
    return List.copyOf(calls);
  }

  public synchronized List<GetRandomPasswordRequest> passwordRequests() {
    return List.copyOf(passwordRequests);
  }

  /** Makes the next {@code count} requests fail with HTTP 429. */
  public synchronized void throttleNext(final int count) {
    throttled = count;
  }

  public SecretsManagerClient client() {
    final var client = mock(SecretsManagerClient.class);
    when(client.getSecretValue(any(GetSecretValueRequest.class)))
        .thenAnswer(inv -> getSecretValue(inv.getArgument(0)));
    when(client.putSecretValue(any(PutSecretValueRequest.class)))
        .thenAnswer(inv -> putSecretValue(inv.getArgument(0)));
    when(client.updateSecretVersionStage(any(UpdateSecretVersionStageRequest.class)))
        .thenAnswer(inv -> updateSecretVersionStage(inv.getArgument(0)));
    when(client.getRandomPassword(any(GetRandomPasswordRequest.class)))
        .thenAnswer(inv -> getRandomPassword(inv.getArgument(0)));
    return client;
  }

  private synchronized GetSecretValueResponse getSecretValue(final GetSecretValueRequest request) {
    observe("GetSecretValue");
    final var stage = Optional.ofNullable(request.versionStage()).orElse("AWSCURRENT");
    final var versionId =
        versionWith(stage)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.builder()
                        .statusCode(400)
                        .message("Secrets Manager can't find the specified secret value")
                        .build());
    final var version = versions.get(versionId);
    return GetSecretValueResponse.builder()
        .arn(arn())
        .name(secretId)
        .versionId(versionId)
        .secretString(version.secretString())
        .versionStages(version.stages())
        .build();
  }

  private synchronized PutSecretValueResponse putSecretValue(final PutSecretValueRequest request) {
    observe("PutSecretValue");
    final var versionId = request.clientRequestToken();
    final var existing = versions.get(versionId);
    if (existing != null && !existing.secretString().equals(request.secretString())) {
      throw ResourceExistsException.builder()
          .statusCode(400)
          .message("A resource with the ID you requested already exists")
          .build();
    }
    if (existing == null) {
      putVersion(versionId, request.secretString(), request.versionStages().toArray(String[]::new));
    }
    return PutSecretValueResponse.builder().arn(arn()).versionId(versionId).build();
  }

  private synchronized UpdateSecretVersionStageResponse updateSecretVersionStage(
      final UpdateSecretVersionStageRequest request) {
    observe("UpdateSecretVersionStage");
    final var stage = request.versionStage();
    final var holder = versionWith(stage);
    if (holder.isPresent() && !holder.get().equals(request.removeFromVersionId())) {
      throw InvalidParameterException.builder()
          .statusCode(400)
          .message("The parameter RemoveFromVersionId doesn't match the version holding " + stage)
          .build();
    }
    moveStage(stage, request.moveToVersionId());
    if (VersionStage.CURRENT.label().equals(stage)) {
      holder.ifPresent(previous -> moveStage("AWSPREVIOUS", previous));
    }
    return UpdateSecretVersionStageResponse.builder().arn(arn()).name(secretId).build();
  }

  private synchronized GetRandomPasswordResponse getRandomPassword(
      final GetRandomPasswordRequest request) {
    observe("GetRandomPassword");
    passwordRequests.add(request);
    return GetRandomPasswordResponse.builder()
        .randomPassword("generated-" + generated.incrementAndGet())
        .build();
  }

  private void observe(final String operation) {
    calls.add(operation);
    if (throttled > 0) {
      throttled--;
      throw SecretsManagerException.builder()
          .statusCode(429)
          .message("Too Many Requests")
          .build();
    }
  }

  private void moveStage(final String stage, final String versionId) {
    versions.values().forEach(v -> v.stages().remove(stage));
    versions.get(versionId).stages().add(stage);
  }
}
