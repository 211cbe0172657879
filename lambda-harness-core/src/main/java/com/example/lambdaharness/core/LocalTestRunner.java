package com.example.lambdaharness.core;

import static java.lang.System.Logger.Level.INFO;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replays recorded invocations through a {@link Harness} without the Lambda runtime.
 *
 * <p>The test document looks like:
 *
 * <pre>{@code
 * {
 *   "region": "eu-central-1",
 *   "invocations": [ { ...event... }, { ...event... } ]
 * }
 * }</pre>
 *
 * <p>Invocations run one after the other with no deadline. The first failing invocation aborts the
 * replay and its exception propagates.
 */
public final class LocalTestRunner {

  private static final System.Logger LOGGER = System.getLogger(LocalTestRunner.class.getName());

  private final ObjectMapper mapper;

  public LocalTestRunner() {
    this(new ObjectMapper());
  }

  public LocalTestRunner(final ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * Replays the invocations of a test document stored in a file.
   *
   * @param harness harness to invoke
   * @param eventType event type of the harness
   * @param testData path of the test document
   * @param <E> event type
   * @param <R> return type
   * @return results in invocation order
   * @throws Exception the first invocation failure
   */
  public <E, R> List<R> replay(
      final Harness<?, E, R> harness, final Class<E> eventType, final Path testData)
      throws Exception {
    return replay(harness, eventType, Files.readString(testData, StandardCharsets.UTF_8));
  }

  /**
   * Replays the invocations of a test document.
   *
   * @param harness harness to invoke
   * @param eventType event type of the harness
   * @param testData test document JSON
   * @param <E> event type
   * @param <R> return type
   * @return results in invocation order
   * @throws ConfigurationException if the document is malformed or has no region
   * @throws Exception the first invocation failure
   */
  public <E, R> List<R> replay(
      final Harness<?, E, R> harness, final Class<E> eventType, final String testData)
      throws Exception {
    final JsonNode document;
    try {
      document = mapper.readTree(testData);
    } catch (final JsonProcessingException e) {
      throw new ConfigurationException("Unable to parse test data", e);
    }
    if (document == null || !document.isObject()) {
      throw new ConfigurationException("Test data must be a JSON object");
    }

    final var region =
        Optional.ofNullable(document.get("region"))
            .filter(JsonNode::isTextual)
            .map(JsonNode::asText)
            .filter(value -> !value.isBlank())
            .orElseThrow(() -> new ConfigurationException("Test data is missing a region"));
    final var invocations =
        Optional.ofNullable(document.get("invocations"))
            .filter(JsonNode::isArray)
            .orElseThrow(() -> new ConfigurationException("Test data is missing invocations"));

    final var events = new ArrayList<E>(invocations.size());
    for (final var node : invocations) {
      try {
        events.add(mapper.treeToValue(node, eventType));
      } catch (final IOException e) {
        throw new ConfigurationException("Unable to parse invocation: " + node, e);
      }
    }

    final var context = InvocationContext.local(region);
    final var results = new ArrayList<R>(events.size());
    for (final var event : events) {
      final var result = harness.invoke(event, context);
      LOGGER.log(INFO, "Invocation result: {0}", result);
      results.add(result);
    }
    return results;
  }
}
