package com.example.lambdaharness.core.secrets;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkServiceException;

/**
 * Retry helper for secret store requests rejected by provider-side rate limiting.
 *
 * <p>Only throttling responses are retried: HTTP 429, or a 400/503 response whose error code or
 * body names a throttling condition. Every other failure is rethrown on the first attempt.
 */
public final class ThrottleRetry {

  private static final System.Logger LOGGER = System.getLogger(ThrottleRetry.class.getName());

  private static final Set<String> THROTTLING_CODES =
      Set.of(
          "ThrottlingException",
          "Throttling",
          "TooManyRequestsException",
          "RequestLimitExceeded",
          "SlowDown");

  private static final String[] THROTTLING_KEYWORDS =
      new String[] {"ThrottlingException", "Too Many Requests", "SlowDown", "Rate exceeded"};

  private ThrottleRetry() {}

  /**
   * Throttle retry policy with capped exponential backoff.
   *
   * @param maxAttempts maximum number of attempts (including first), must be >= 1; {@link
   *     Integer#MAX_VALUE} means unbounded
   * @param initialDelayMillis delay before the first retry in milliseconds, must be >= 0
   * @param maxDelayMillis maximum delay cap, must be >= initialDelayMillis
   * @param backoffMultiplier multiplier applied per retry (1.0 = fixed delay), must be >= 1.0
   */
  public record Policy(
      int maxAttempts, long initialDelayMillis, long maxDelayMillis, double backoffMultiplier) {

    /** Eight attempts, 100 ms doubling up to 1.6 s. */
    public static final Policy DEFAULT = exponential(8, 100L);

    public Policy {
      if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
      if (initialDelayMillis < 0)
        throw new IllegalArgumentException("initialDelayMillis must be >= 0");
      if (maxDelayMillis < initialDelayMillis)
        throw new IllegalArgumentException("maxDelayMillis must be >= initialDelayMillis");
      if (backoffMultiplier < 1.0)
        throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
    }

    /**
     * Creates a fixed delay policy.
     *
     * @param attempts number of attempts (including first)
     * @param delayMillis delay between attempts in milliseconds
     * @return fixed delay policy
     */
    public static Policy fixed(final int attempts, final long delayMillis) {
      return new Policy(attempts, delayMillis, delayMillis, 1.0);
    }

    /**
     * Creates a doubling backoff policy capped at sixteen times the initial delay.
     *
     * @param attempts number of attempts (including first)
     * @param initialDelay initial delay in milliseconds
     * @return exponential policy
     */
    public static Policy exponential(final int attempts, final long initialDelay) {
      return new Policy(attempts, initialDelay, initialDelay * 16, 2.0);
    }

    /**
     * Retries throttled requests for as long as the store keeps throttling them.
     *
     * <p>Only the invocation deadline bounds such a loop.
     *
     * @param initialDelay initial delay in milliseconds
     * @return unbounded exponential policy
     */
    public static Policy unbounded(final long initialDelay) {
      return new Policy(Integer.MAX_VALUE, initialDelay, initialDelay * 16, 2.0);
    }

    public boolean isUnbounded() {
      return maxAttempts == Integer.MAX_VALUE;
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param attempt failed attempt number (1-based)
     * @return delay in milliseconds
     */
    long delayAfter(final int attempt) {
      if (backoffMultiplier == 1.0 || attempt <= 1) return initialDelayMillis;
      final var delay = initialDelayMillis * Math.pow(backoffMultiplier, attempt - 1);
      return (long) Math.min(delay, maxDelayMillis);
    }
  }

  /**
   * Executes the request, retrying while it is throttled and the policy allows another attempt.
   *
   * @param operation store operation name, for logging
   * @param request the request to execute
   * @param policy retry policy
   * @param <T> response type
   * @return the response
   * @throws SdkServiceException the last throttling failure once attempts are exhausted, or any
   *     non-throttling failure immediately
   */
  public static <T> T run(
      final String operation, final Supplier<? extends T> request, final Policy policy) {
    var attempt = 0;
    while (true) {
      attempt++;
      try {
        return request.get();
      } catch (final SdkServiceException e) {
        if (!isThrottling(e)) throw e;

        if (attempt >= policy.maxAttempts()) {
          LOGGER.log(WARNING, "{0} still throttled after {1} attempts", operation, attempt);
          throw e;
        }

        final var delay = policy.delayAfter(attempt);
        LOGGER.log(
            WARNING,
            "Cooling down to prevent request limits: {0} attempt {1}, sleeping {2} ms",
            operation,
            attempt,
            delay);

        if (delay > 0) {
          try {
            Thread.sleep(delay);
          } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw e;
          }
        }
      }
    }
  }

  /**
   * Detects provider-side rate limiting.
   *
   * @param e the service failure
   * @return true if the request was throttled
   */
  static boolean isThrottling(final SdkServiceException e) {
    if (e == null) return false;

    final var status = e.statusCode();
    if (status == 429) return true;
    if (status != 400 && status != 503) return false;

    if (e.isThrottlingException()) return true;

    if (e instanceof AwsServiceException aws && aws.awsErrorDetails() != null) {
      final var details = aws.awsErrorDetails();
      if (details.errorCode() != null && THROTTLING_CODES.contains(details.errorCode())) {
        return true;
      }
      if (containsKeyword(rawBody(details))) return true;
    }

    LOGGER.log(DEBUG, "Status {0} is not a throttling response", status);
    return containsKeyword(e.getMessage());
  }

  private static String rawBody(final AwsErrorDetails details) {
    return Optional.ofNullable(details.rawResponse())
        .map(SdkBytes::asByteArray)
        .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
        .orElse(null);
  }

  private static boolean containsKeyword(final String text) {
    if (text == null) return false;
    for (final var keyword : THROTTLING_KEYWORDS) if (text.contains(keyword)) return true;
    return false;
  }
}
