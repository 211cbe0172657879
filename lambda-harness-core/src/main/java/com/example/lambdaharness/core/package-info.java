/**
 * Root package of the lambda-harness library.
 *
 * <p>It runs user work per invocation and turns a deadline overrun into an observable failure.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.lambdaharness.core.Runner} – user work executed on every invocation.
 *   <li>{@link com.example.lambdaharness.core.Harness} – races the work against the deadline and
 *       owns the shared state.
 *   <li>{@link com.example.lambdaharness.core.DeadlineScheduler} – wakes up shortly before an
 *       absolute deadline.
 *   <li>{@link com.example.lambdaharness.core.LambdaHarnessHandler} – adapter to the AWS Lambda
 *       Java runtime.
 *   <li>{@link com.example.lambdaharness.core.LocalTestRunner} – replays recorded invocations
 *       without the runtime.
 *   <li>{@link com.example.lambdaharness.core.HarnessConfig} – region, endpoint, credentials and
 *       throttling settings.
 *   <li>{@link com.example.lambdaharness.core.rotation} – Secrets Manager rotation protocol.
 *   <li>{@link com.example.lambdaharness.core.secrets} – typed access to a version-staged secret
 *       store.
 * </ul>
 */
package com.example.lambdaharness.core;
