package com.example.lambdaharness.examples.postgres;

import com.example.lambdaharness.core.InvocationContext;
import com.example.lambdaharness.core.rotation.RotationLambdaHandler;
import com.example.lambdaharness.core.rotation.RotationRunner;
import com.example.lambdaharness.core.secrets.SecretContainer;
import com.example.lambdaharness.core.secrets.SecretStore;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Rotates the password of a PostgreSQL user.
 *
 * <ul>
 *   <li>create: asks the store for a new password
 *   <li>set: logs in with the current password and changes it to the pending one
 *   <li>test: logs in with the pending password
 * </ul>
 */
public final class PostgresRotationRunner implements RotationRunner<Void, PostgresSecret> {

  private final String sslMode;

  public PostgresRotationRunner(final String sslMode) {
    this.sslMode = sslMode;
  }

  @Override
  public Class<PostgresSecret> secretType() {
    return PostgresSecret.class;
  }

  @Override
  public SecretContainer<PostgresSecret> create(
      final Void shared,
      final SecretContainer<PostgresSecret> current,
      final SecretStore store,
      final InvocationContext context) {
    final var password = store.generatePassword(false);
    return current.withData(current.data().withPassword(password));
  }

  @Override
  public void set(
      final Void shared,
      final SecretContainer<PostgresSecret> current,
      final SecretContainer<PostgresSecret> pending,
      final InvocationContext context)
      throws SQLException {
    try (final var database = PostgresDatabase.connect(current.data(), sslMode)) {
      database.changePassword(pending.data());
    }
  }

  @Override
  public void test(
      final Void shared,
      final SecretContainer<PostgresSecret> pending,
      final InvocationContext context)
      throws SQLException {
    try (final var database = PostgresDatabase.connect(pending.data(), sslMode)) {
      database.testConnection();
    }
  }

  /**
   * Lambda entry point. The SSL mode comes from {@code PGSSLMODE} and defaults to {@code
   * require}.
   */
  public static final class Handler extends RotationLambdaHandler<Void, PostgresSecret> {
    public Handler() {
      super(config -> new PostgresRotationRunner(sslMode()), () -> null);
    }

    private static String sslMode() {
      return Optional.ofNullable(System.getenv("PGSSLMODE"))
          .filter(mode -> !mode.isBlank())
          .orElse("require");
    }
  }
}
