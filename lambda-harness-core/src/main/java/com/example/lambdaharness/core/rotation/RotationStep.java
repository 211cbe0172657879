package com.example.lambdaharness.core.rotation;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Step of the Secrets Manager rotation protocol, in the order the service invokes them. */
public enum RotationStep {
  @JsonProperty("createSecret")
  CREATE,
  @JsonProperty("setSecret")
  SET,
  @JsonProperty("testSecret")
  TEST,
  @JsonProperty("finishSecret")
  FINISH
}
