package com.example.lambdaharness.core.secrets;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Secret payload split into the fields a caller's type models and everything else.
 *
 * <p>Secrets often carry store-managed or tool-managed fields the caller doesn't care about.
 * Keeping them in {@link #extra()} means overwriting the secret never drops them: {@link
 * SecretCodec} writes the union of both parts back.
 *
 * @param data typed fields
 * @param extra fields absent from the typed shape, keyed by name
 * @param <T> typed shape of the payload
 */
public record SecretContainer<T>(T data, Map<String, JsonNode> extra) {

  public SecretContainer {
    Objects.requireNonNull(data, "data");
    extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
  }

  /**
   * Container without extra fields.
   *
   * @param data typed fields
   * @param <T> typed shape
   * @return container
   */
  public static <T> SecretContainer<T> of(final T data) {
    return new SecretContainer<>(data, Map.of());
  }

  /**
   * Replaces the typed part and keeps the extra fields, which is how a rotation candidate is
   * derived from the current secret.
   *
   * @param newData new typed fields
   * @return new container
   */
  public SecretContainer<T> withData(final T newData) {
    return new SecretContainer<>(newData, extra);
  }
}
