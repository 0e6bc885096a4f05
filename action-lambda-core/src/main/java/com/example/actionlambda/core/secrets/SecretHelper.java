package com.example.actionlambda.core.secrets;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Fetches a database secret from AWS Secrets Manager and deserializes it into a {@link DbSecret}
 * using Jackson.
 */
public final class SecretHelper {

  private static Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;
  private static Function<String, String> secretSource = SecretsManagerProvider::getSecret;

  private SecretHelper() {}

  /**
   * Sets the supplier of the {@link ObjectMapper} used for deserialization.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier;
  }

  /**
   * Replaces where raw secret strings come from; {@code null} restores Secrets Manager.
   *
   * @param source secret id to secret JSON lookup
   */
  public static void setSecretSource(final Function<String, String> source) {
    secretSource = source == null ? SecretsManagerProvider::getSecret : source;
  }

  /**
   * Retrieves a DB secret and converts it into a {@link DbSecret}.
   *
   * @param secretId the identifier/name of the secret in AWS Secrets Manager
   * @return the parsed {@link DbSecret}
   * @throws IllegalStateException if the secret cannot be fetched or parsed
   */
  public static DbSecret getDbSecret(final String secretId) {
    try {
      final var secret = secretSource.apply(secretId);
      return mapperSupplier.get().readValue(secret, DbSecret.class);
    } catch (final Exception exception) {
      throw new IllegalStateException("Failed to load DB secret " + secretId, exception);
    }
  }
}
