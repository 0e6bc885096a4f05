package com.example.actionlambda.core.secrets;

import static java.lang.System.Logger.Level.WARNING;

import java.net.URI;
import java.util.Optional;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;

/**
 * Lazily configured AWS Secrets Manager client.
 *
 * <p>Configuration can be supplied via system properties or environment variables:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION (default us-east-1)
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
 * </ul>
 *
 * <p>Credentials come from the SDK default provider chain, which on Lambda is the function's
 * execution role.
 */
public final class SecretsManagerProvider {

  private static final System.Logger logger =
      System.getLogger(SecretsManagerProvider.class.getName());

  private static volatile SecretsManagerClient client;

  private SecretsManagerProvider() {}

  /** Closes the current client; the next access builds a new one with current configuration. */
  public static synchronized void resetClient() {
    Optional.ofNullable(client)
        .ifPresent(
            c -> {
              try {
                c.close();
              } catch (final Exception e) {
                logger.log(WARNING, "Failed to close SecretsManagerClient", e);
              }
            });
    client = null;
  }

  /**
   * Retrieves the raw secret string for the given secret identifier.
   *
   * @param secretId the Secrets Manager secret ID or name
   * @return the secret string as stored in Secrets Manager
   */
  public static String getSecret(final String secretId) {
    final var request = GetSecretValueRequest.builder().secretId(secretId).build();
    return getClient().getSecretValue(request).secretString();
  }

  static synchronized SecretsManagerClient getClient() {
    return Optional.ofNullable(client).orElseGet(() -> client = buildClient());
  }

  private static SecretsManagerClient buildClient() {
    final var builder = SecretsManagerClient.builder();

    final var region =
        Optional.ofNullable(System.getProperty("aws.region"))
            .or(() -> Optional.ofNullable(System.getenv("AWS_REGION")))
            .map(Region::of)
            .orElse(Region.US_EAST_1);
    builder.region(region);

    Optional.ofNullable(System.getProperty("aws.sm.endpoint"))
        .or(() -> Optional.ofNullable(System.getenv("AWS_SM_ENDPOINT")))
        .map(URI::create)
        .ifPresent(builder::endpointOverride);

    return builder.build();
  }
}
