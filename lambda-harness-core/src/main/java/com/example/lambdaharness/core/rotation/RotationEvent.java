package com.example.lambdaharness.core.rotation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Event sent by Secrets Manager for each rotation step. All three fields are required.
 *
 * @param clientRequestToken idempotency token of the rotation attempt, also the pending version id
 * @param secretId id or arn of the rotated secret
 * @param step the step to run
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RotationEvent(
    @JsonProperty(value = "ClientRequestToken", required = true) String clientRequestToken,
    @JsonProperty(value = "SecretId", required = true) String secretId,
    @JsonProperty(value = "Step", required = true) RotationStep step) {

  public RotationEvent {
    Objects.requireNonNull(clientRequestToken, "ClientRequestToken");
    Objects.requireNonNull(secretId, "SecretId");
    Objects.requireNonNull(step, "Step");
  }
}
