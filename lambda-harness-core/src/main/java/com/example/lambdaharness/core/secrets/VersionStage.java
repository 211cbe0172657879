package com.example.lambdaharness.core.secrets;

/** Store-side labels attached to secret versions during rotation. */
public enum VersionStage {
  /** The live, in-use credential. */
  CURRENT("AWSCURRENT"),
  /** The candidate credential being rotated in. */
  PENDING("AWSPENDING");

  private final String label;

  VersionStage(final String label) {
    this.label = label;
  }

  /** Wire name of the stage as understood by Secrets Manager. */
  public String label() {
    return label;
  }
}
