package com.example.actionlambda.handler;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Handler configuration, resolved from a system property first and an environment variable
 * second:
 *
 * <ul>
 *   <li>env.file.bucket / ENV_FILE_BUCKET - S3 bucket receiving generated env files
 *   <li>env.file.prefix / ENV_FILE_PREFIX - key prefix, default {@code env/}
 *   <li>pipeline.name / PIPELINE_NAME - CodePipeline started after a deploy upload
 * </ul>
 *
 * <p>Missing deploy settings are tolerated here and reported when a deploy is attempted, so a
 * destroy-only function does not need them.
 *
 * @param envFileBucket S3 bucket name, may be null
 * @param envFilePrefix S3 key prefix
 * @param pipelineName pipeline name, may be null
 */
public record HandlerSettings(String envFileBucket, String envFilePrefix, String pipelineName) {

  public static final String ENV_FILE_BUCKET = "ENV_FILE_BUCKET";
  public static final String ENV_FILE_PREFIX = "ENV_FILE_PREFIX";
  public static final String PIPELINE_NAME = "PIPELINE_NAME";
  public static final String DEFAULT_PREFIX = "env/";

  public HandlerSettings {
    envFilePrefix = envFilePrefix == null ? DEFAULT_PREFIX : envFilePrefix;
  }

  public static HandlerSettings fromEnvironment() {
    return from(HandlerSettings::lookup);
  }

  /**
   * Reads settings through the given key lookup (environment variable names as keys).
   *
   * @param env key lookup returning null for absent keys
   * @return handler settings
   */
  public static HandlerSettings from(final Function<String, String> env) {
    return new HandlerSettings(
        value(env, ENV_FILE_BUCKET), value(env, ENV_FILE_PREFIX), value(env, PIPELINE_NAME));
  }

  /**
   * S3 key of the env file for a stack.
   *
   * @param stackName stack name
   * @return object key
   */
  public String envFileKey(final String stackName) {
    return envFilePrefix + stackName + ".env";
  }

  /**
   * Fails when a deploy cannot run with these settings.
   *
   * @throws IllegalStateException naming the first missing key
   */
  public void requireDeploySettings() {
    if (envFileBucket == null) throw new IllegalStateException(ENV_FILE_BUCKET + " is not set");
    if (pipelineName == null) throw new IllegalStateException(PIPELINE_NAME + " is not set");
  }

  private static String value(final Function<String, String> env, final String key) {
    return Optional.ofNullable(env.apply(key)).filter(v -> !v.isBlank()).orElse(null);
  }

  private static String lookup(final String key) {
    final var property = key.toLowerCase(Locale.ROOT).replace('_', '.');
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(key)))
        .orElse(null);
  }
}
