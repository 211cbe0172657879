package com.example.lambdaharness.core;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class HarnessTest {

  private static final String REGION = "eu-central-1";

  private static InvocationContext deadlineIn(final long millis) {
    return InvocationContext.withDeadline(
        REGION, Instant.now().plusMillis(millis), "request-1");
  }

  @Nested
  @DisplayName("Invocation Outcome")
  class InvocationOutcome {

    @Test
    @DisplayName("Should return the result of work finishing before the deadline")
    void shouldReturnResult() throws Exception {
      try (final var harness =
          Harness.<Void, String, String>builder((shared, event, ctx) -> event.toUpperCase())
              .build()) {
        assertEquals("HELLO", harness.invoke("hello", deadlineIn(5_000)));
      }
    }

    @Test
    @DisplayName("Should rethrow the failure of the work unchanged")
    void shouldRethrowFailureVerbatim() {
      final var failure = new IOException("boom");
      try (final var harness =
          Harness.<Void, String, String>builder(
                  (shared, event, ctx) -> {
                    throw failure;
                  })
              .build()) {
        final var thrown =
            assertThrows(IOException.class, () -> harness.invoke("x", deadlineIn(5_000)));
        assertSame(failure, thrown);
      }
    }

    @Test
    @DisplayName("Should rethrow unchecked failures unchanged")
    void shouldRethrowUncheckedFailure() {
      try (final var harness =
          Harness.<Void, String, String>builder(
                  (shared, event, ctx) -> {
                    throw new IllegalArgumentException("bad event");
                  })
              .build()) {
        final var thrown =
            assertThrows(
                IllegalArgumentException.class,
                () -> harness.invoke("x", InvocationContext.local(REGION)));
        assertEquals("bad event", thrown.getMessage());
      }
    }
  }

  @Nested
  @DisplayName("Deadline Race")
  class DeadlineRace {

    @Test
    @DisplayName("Should cancel the deadline timer when the work cannot be submitted")
    void shouldCancelTimerWhenRejected() {
      final var executor = Executors.newSingleThreadExecutor();
      executor.shutdown();
      final var scheduler = new DeadlineScheduler();
      try (final var harness =
          Harness.<Void, String, String>builder((shared, event, ctx) -> event)
              .executor(executor)
              .scheduler(scheduler)
              .build()) {
        assertThrows(
            RejectedExecutionException.class, () -> harness.invoke("late", deadlineIn(60_000)));
        assertEquals(0, scheduler.pendingTimers());
      }
    }

    @Test
    @DisplayName("Should fail with a timeout when the work outlives the deadline")
    void shouldTimeOut() {
      final var release = new CountDownLatch(1);
      try (final var harness =
          Harness.<Void, String, String>builder(
                  (shared, event, ctx) -> {
                    release.await(10, TimeUnit.SECONDS);
                    return "late";
                  })
              .build()) {
        final var started = System.nanoTime();
        final var deadline = Instant.now().plusMillis(500);
        final var thrown =
            assertThrows(
                InvocationTimeoutException.class,
                () -> harness.invoke("x", InvocationContext.withDeadline(REGION, deadline, null)));
        final var elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(deadline, thrown.deadline());
        assertTrue(thrown.getMessage().contains("Lambda failed by running into a timeout"));
        assertTrue(elapsed < 2_000, "Timed out too late: %d ms".formatted(elapsed));
      } finally {
        release.countDown();
      }
    }

    @Test
    @DisplayName("Should time out immediately when the deadline has already passed")
    void shouldTimeOutForPastDeadline() {
      final var release = new CountDownLatch(1);
      try (final var harness =
          Harness.<Void, String, String>builder(
                  (shared, event, ctx) -> {
                    release.await(10, TimeUnit.SECONDS);
                    return "late";
                  })
              .build()) {
        assertThrows(InvocationTimeoutException.class, () -> harness.invoke("x", deadlineIn(-10)));
      } finally {
        release.countDown();
      }
    }

    @Test
    @DisplayName("Should wait for the work when there is no deadline")
    void shouldWaitWithoutDeadline() throws Exception {
      try (final var harness =
          Harness.<Void, String, String>builder(
                  (shared, event, ctx) -> {
                    Thread.sleep(300);
                    return "done";
                  })
              .build()) {
        assertEquals("done", harness.invoke("x", InvocationContext.local(REGION)));
      }
    }
  }

  @Nested
  @DisplayName("Lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("Should create shared state once and reuse it across invocations")
    void shouldCreateSharedStateOnce() throws Exception {
      final var created = new AtomicInteger();
      try (final var harness =
          Harness.<AtomicInteger, String, Integer>builder(
                  (shared, event, ctx) -> shared.incrementAndGet())
              .sharedState(
                  () -> {
                    created.incrementAndGet();
                    return new AtomicInteger();
                  })
              .build()) {
        assertEquals(1, harness.invoke("a", InvocationContext.local(REGION)));
        assertEquals(2, harness.invoke("b", InvocationContext.local(REGION)));
        assertEquals(3, harness.invoke("c", deadlineIn(5_000)));
        assertEquals(1, created.get());
        assertSame(harness.shared(), harness.shared());
      }
    }

    @Test
    @DisplayName("Should call setup once when the harness is built")
    void shouldCallSetupOnce() throws Exception {
      final var setups = new AtomicInteger();
      final Runner<Void, String, String> runner =
          new Runner<>() {
            @Override
            public void setup() {
              setups.incrementAndGet();
            }

            @Override
            public String run(final Void shared, final String event, final InvocationContext ctx) {
              return event;
            }
          };

      try (final var harness = Harness.builder(runner).build()) {
        harness.invoke("a", InvocationContext.local(REGION));
        harness.invoke("b", InvocationContext.local(REGION));
      }
      assertEquals(1, setups.get());
    }

    @Test
    @DisplayName("Should wrap setup failures in a configuration exception")
    void shouldWrapSetupFailure() {
      final Runner<Void, String, String> runner =
          new Runner<>() {
            @Override
            public void setup() throws Exception {
              throw new IOException("no database");
            }

            @Override
            public String run(final Void shared, final String event, final InvocationContext ctx) {
              return event;
            }
          };

      final var thrown =
          assertThrows(ConfigurationException.class, () -> Harness.builder(runner).build());
      assertInstanceOf(IOException.class, thrown.getCause());
    }

    @Test
    @DisplayName("Should reject a missing runner or shared state factory")
    void shouldValidateBuilder() {
      assertThrows(
          IllegalStateException.class,
          () -> Harness.<Void, String, String>builder(null).build());
      assertThrows(
          IllegalStateException.class,
          () ->
              Harness.<Void, String, String>builder((shared, event, ctx) -> event)
                  .sharedState(null)
                  .build());
    }
  }
}
