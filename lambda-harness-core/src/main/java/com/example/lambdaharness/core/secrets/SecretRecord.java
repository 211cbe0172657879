package com.example.lambdaharness.core.secrets;

/**
 * A secret version as read from the store. Instances come from {@link SecretStore#fetch} and
 * {@link SecretStore#find}.
 *
 * @param arn arn of the secret
 * @param versionId opaque version token assigned by the store
 * @param container parsed secret payload
 * @param <T> typed shape of the payload
 */
public record SecretRecord<T>(String arn, String versionId, SecretContainer<T> container) {}
