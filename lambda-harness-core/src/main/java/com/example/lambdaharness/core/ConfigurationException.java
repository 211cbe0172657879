package com.example.lambdaharness.core;

/**
 * Raised when the harness cannot be set up: a missing region, a malformed local test document, or
 * a runner whose {@link Runner#setup()} failed. Always reported before any invocation runs.
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(final String message) {
    super(message);
  }

  public ConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
