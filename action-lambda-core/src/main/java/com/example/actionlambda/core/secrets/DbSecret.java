package com.example.actionlambda.core.secrets;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Database credentials stored in AWS Secrets Manager.
 *
 * <p>Fields map directly to the RDS secret JSON structure; additional keys such as {@code
 * dbInstanceIdentifier} are ignored.
 *
 * @param username database username
 * @param password database password
 * @param engine database engine identifier (e.g., mysql)
 * @param host database host name or address
 * @param port database port number
 * @param dbname database name/schema, may be absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DbSecret(
    String username, String password, String engine, String host, int port, String dbname) {

  @Override
  public String toString() {
    return "DbSecret[username=%s, password=****, engine=%s, host=%s, port=%d, dbname=%s]"
        .formatted(username, engine, host, port, dbname);
  }
}
