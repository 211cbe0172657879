package com.example.lambdaharness.core.secrets;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Converts between secret payload JSON and {@link SecretContainer}.
 *
 * <p>The set of fields a type models is taken from Jackson's own view of the type (honoring
 * {@code @JsonProperty} renames), so exactly the fields Jackson would not bind land in {@link
 * SecretContainer#extra()}.
 */
public class SecretCodec {

  private final ObjectMapper mapper;
  private final Map<Class<?>, Set<String>> knownFields = new ConcurrentHashMap<>();

  public SecretCodec() {
    this(new ObjectMapper());
  }

  public SecretCodec(final ObjectMapper mapper) {
    this.mapper = mapper.copy().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /**
   * Parses a secret string.
   *
   * @param payload JSON object text
   * @param type typed shape
   * @param <T> typed shape
   * @return the container
   * @throws JsonProcessingException if the payload is not a JSON object or doesn't bind to {@code
   *     type}
   */
  public <T> SecretContainer<T> parse(final String payload, final Class<T> type)
      throws JsonProcessingException {
    return fromTree(mapper.readTree(payload), type);
  }

  /**
   * Parses a binary secret holding UTF-8 JSON.
   *
   * @param payload JSON object bytes
   * @param type typed shape
   * @param <T> typed shape
   * @return the container
   * @throws IOException if the payload is not a JSON object or doesn't bind to {@code type}
   */
  public <T> SecretContainer<T> parse(final byte[] payload, final Class<T> type)
      throws IOException {
    return fromTree(mapper.readTree(payload), type);
  }

  /**
   * Serializes the typed fields and the extra fields into one JSON object.
   *
   * @param container the container
   * @return JSON object text
   * @throws JsonProcessingException if the typed part cannot be serialized as a JSON object
   */
  public String serialize(final SecretContainer<?> container) throws JsonProcessingException {
    final JsonNode typed;
    try {
      typed = mapper.valueToTree(container.data());
    } catch (final IllegalArgumentException e) {
      throw MismatchedInputException.from(
          null, container.data().getClass(), "Unable to serialize secret: " + e.getMessage());
    }
    if (!(typed instanceof ObjectNode node)) {
      throw MismatchedInputException.from(
          null, container.data().getClass(), "Secret type must serialize to a JSON object");
    }
    container.extra().forEach(node::putIfAbsent);
    return mapper.writeValueAsString(node);
  }

  private <T> SecretContainer<T> fromTree(final JsonNode tree, final Class<T> type)
      throws JsonProcessingException {
    if (tree == null || !tree.isObject()) {
      throw MismatchedInputException.from(null, type, "Secret payload must be a JSON object");
    }

    final T data = mapper.treeToValue(tree, type);
    if (data == null) {
      throw MismatchedInputException.from(null, type, "Secret payload bound to null");
    }

    final var known = knownFields(type);
    final var extra = new LinkedHashMap<String, JsonNode>();
    tree.fields()
        .forEachRemaining(
            field -> {
              if (!known.contains(field.getKey())) extra.put(field.getKey(), field.getValue());
            });
    return new SecretContainer<>(data, extra);
  }

  private Set<String> knownFields(final Class<?> type) {
    return knownFields.computeIfAbsent(
        type,
        t -> {
          final var javaType = mapper.constructType(t);
          final var deserialized =
              mapper.getDeserializationConfig().introspect(javaType).findProperties();
          final var serialized =
              mapper.getSerializationConfig().introspect(javaType).findProperties();
          return Stream.concat(deserialized.stream(), serialized.stream())
              .map(BeanPropertyDefinition::getName)
              .collect(Collectors.toUnmodifiableSet());
        });
  }
}
