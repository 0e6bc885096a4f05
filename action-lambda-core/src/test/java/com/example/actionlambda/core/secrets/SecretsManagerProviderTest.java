package com.example.actionlambda.core.secrets;

import static org.junit.jupiter.api.Assertions.*;

import java.net.URI;
import org.junit.jupiter.api.*;
import software.amazon.awssdk.regions.Region;

class SecretsManagerProviderTest {

  @BeforeEach
  void setup() {
    clearAwsProps();
    SecretsManagerProvider.resetClient();
  }

  @AfterEach
  void tearDown() {
    SecretsManagerProvider.resetClient();
    clearAwsProps();
  }

  private static void clearAwsProps() {
    System.clearProperty("aws.region");
    System.clearProperty("aws.sm.endpoint");
  }

  @Test
  @DisplayName("buildClient honors region and endpoint properties")
  void buildClientHonorsProperties() {
    System.setProperty("aws.region", "ap-northeast-1");
    System.setProperty("aws.sm.endpoint", "http://localhost:4566");

    final var client = SecretsManagerProvider.getClient();

    assertEquals(Region.AP_NORTHEAST_1, client.serviceClientConfiguration().region());
    assertEquals(
        URI.create("http://localhost:4566"),
        client.serviceClientConfiguration().endpointOverride().orElseThrow());
  }

  @Test
  @DisplayName("getClient reuses the client until reset")
  void getClientIsCachedUntilReset() {
    System.setProperty("aws.region", "us-east-1");

    final var first = SecretsManagerProvider.getClient();
    assertSame(first, SecretsManagerProvider.getClient());

    SecretsManagerProvider.resetClient();

    assertNotSame(first, SecretsManagerProvider.getClient());
  }
}
