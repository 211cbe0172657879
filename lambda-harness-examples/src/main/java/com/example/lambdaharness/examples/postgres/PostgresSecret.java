package com.example.lambdaharness.examples.postgres;

/**
 * Database credentials as stored in the rotated secret.
 *
 * <p>Fields follow the common RDS secret JSON structure. Other fields of the secret, such as
 * {@code engine}, are carried along untouched by the rotation.
 *
 * @param username database user whose password is rotated
 * @param password database password
 * @param host database host name or address
 * @param port database port number
 * @param dbname database name
 */
public record PostgresSecret(
    String username, String password, String host, int port, String dbname) {

  /**
   * Same credentials with another password.
   *
   * @param newPassword the password
   * @return new secret
   */
  public PostgresSecret withPassword(final String newPassword) {
    return new PostgresSecret(username, newPassword, host, port, dbname);
  }

  /**
   * JDBC url of the database.
   *
   * @return url
   */
  public String jdbcUrl() {
    return "jdbc:postgresql://%s:%d/%s".formatted(host, port, dbname);
  }
}
