package com.example.lambdaharness.examples.postgres;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Connection to the PostgreSQL database whose credentials are rotated.
 *
 * @param connection open JDBC connection
 */
public record PostgresDatabase(Connection connection) implements AutoCloseable {

  /**
   * Opens a connection authenticated with the given secret.
   *
   * @param secret credentials and location of the database
   * @param sslMode PostgreSQL {@code sslmode}, e.g. {@code require}
   * @return connected database
   * @throws SQLException if the connection cannot be established
   */
  public static PostgresDatabase connect(final PostgresSecret secret, final String sslMode)
      throws SQLException {
    final var properties = new Properties();
    properties.setProperty("user", secret.username());
    properties.setProperty("password", secret.password());
    properties.setProperty("sslmode", sslMode);
    return new PostgresDatabase(DriverManager.getConnection(secret.jdbcUrl(), properties));
  }

  /**
   * Sets the password of the secret's user to the secret's password.
   *
   * <p>{@code ALTER USER} accepts no bind parameters, so the user name and password are quoted
   * here.
   *
   * @param secret secret holding the new password
   * @throws SQLException if the password cannot be changed
   */
  public void changePassword(final PostgresSecret secret) throws SQLException {
    try (final var statement = connection.createStatement()) {
      statement.execute(
          "ALTER USER %s WITH PASSWORD %s"
              .formatted(quoteIdentifier(secret.username()), quoteLiteral(secret.password())));
    }
  }

  /**
   * Runs a trivial query.
   *
   * @throws SQLException if the connection doesn't work
   */
  public void testConnection() throws SQLException {
    try (final var statement = connection.createStatement()) {
      statement.execute("SELECT 1");
    }
  }

  @Override
  public void close() throws SQLException {
    connection.close();
  }

  static String quoteIdentifier(final String identifier) {
    return '"' + identifier.replace("\"", "\"\"") + '"';
  }

  static String quoteLiteral(final String literal) {
    return "'" + literal.replace("'", "''") + "'";
  }
}
