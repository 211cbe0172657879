package com.example.lambdaharness.core.secrets;

/**
 * Permanent secret store failure: missing version, missing arn or version id, unparsable payload,
 * or a request the store rejected for a reason other than throttling.
 */
public class SecretStoreException extends RuntimeException {

  private final String operation;
  private final String secretId;

  public SecretStoreException(final String operation, final String secretId, final String message) {
    this(operation, secretId, message, null);
  }

  public SecretStoreException(
      final String operation, final String secretId, final String message, final Throwable cause) {
    super(
        secretId == null
            ? "%s failed: %s".formatted(operation, message)
            : "%s failed for secret %s: %s".formatted(operation, secretId, message),
        cause);
    this.operation = operation;
    this.secretId = secretId;
  }

  /** Name of the store operation that failed, e.g. {@code GetSecretValue}. */
  public String operation() {
    return operation;
  }

  /** Secret id or arn the operation was issued for, null for secret-independent operations. */
  public String secretId() {
    return secretId;
  }
}
