package com.example.lambdaharness.core.secrets;

import java.util.Optional;

/**
 * Typed operations over a remote, version-staged secret store.
 *
 * <p>Exactly one implementation is wired in at composition time; {@link AwsSecretStore} talks to
 * AWS Secrets Manager. All failures surface as {@link SecretStoreException}, after throttled
 * requests have been retried.
 */
public interface SecretStore {

  /**
   * Fetches the version currently carrying {@code stage}.
   *
   * @param secretId secret id or arn
   * @param stage version stage
   * @param type typed shape of the payload
   * @param <T> typed shape
   * @return the secret version
   * @throws SecretStoreException if no version carries the stage, the response lacks arn or
   *     version id, or the payload doesn't parse as {@code type}
   */
  <T> SecretRecord<T> fetch(String secretId, VersionStage stage, Class<T> type);

  /**
   * Like {@link #fetch}, but returns empty when the store has no version carrying {@code stage}.
   *
   * @param secretId secret id or arn
   * @param stage version stage
   * @param type typed shape of the payload
   * @param <T> typed shape
   * @return the secret version, if any
   * @throws SecretStoreException on every other failure
   */
  <T> Optional<SecretRecord<T>> find(String secretId, VersionStage stage, Class<T> type);

  /**
   * Asks the store for random secret material. The double quote is always excluded.
   *
   * @param excludePunctuation whether punctuation characters are excluded
   * @param length password length; values {@code <= 0} use the store's default
   * @return the generated password
   * @throws SecretStoreException if the store returns no password
   */
  String generatePassword(boolean excludePunctuation, long length);

  /**
   * Same as {@link #generatePassword(boolean, long)} with the store's default length.
   *
   * @param excludePunctuation whether punctuation characters are excluded
   * @return the generated password
   */
  default String generatePassword(final boolean excludePunctuation) {
    return generatePassword(excludePunctuation, 0L);
  }

  /**
   * Writes a new version labelled pending. Repeated calls with the same token are deduplicated by
   * the store.
   *
   * @param secretId secret id or arn
   * @param requestToken idempotency token of the rotation attempt
   * @param container payload to write
   */
  void writePending(String secretId, String requestToken, SecretContainer<?> container);

  /**
   * Moves the current label from {@code currentVersionId} to {@code pendingVersionId}.
   *
   * @param arn arn of the secret
   * @param currentVersionId version losing the current label
   * @param pendingVersionId version gaining the current label
   */
  void promote(String arn, String currentVersionId, String pendingVersionId);
}
