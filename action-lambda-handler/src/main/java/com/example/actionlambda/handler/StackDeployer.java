package com.example.actionlambda.handler;

import static java.lang.System.Logger.Level.INFO;

import com.example.actionlambda.core.repository.SiteMasterRepository;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.codepipeline.CodePipelineClient;
import software.amazon.awssdk.services.codepipeline.model.StartPipelineExecutionRequest;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * Deploys a tenant stack: renders the tenant's site master row as an env file, uploads it to S3
 * and starts the deployment pipeline that picks it up.
 */
final class StackDeployer {

  private static final System.Logger logger = System.getLogger(StackDeployer.class.getName());

  static final String ENV_FILE_CONTENT_TYPE = "text/plain; charset=utf-8";

  private final SiteMasterRepository repository;
  private final S3Client s3;
  private final CodePipelineClient codePipeline;
  private final HandlerSettings settings;

  StackDeployer(
      final SiteMasterRepository repository,
      final S3Client s3,
      final CodePipelineClient codePipeline,
      final HandlerSettings settings) {
    this.repository = Objects.requireNonNull(repository, "repository");
    this.s3 = Objects.requireNonNull(s3, "s3");
    this.codePipeline = Objects.requireNonNull(codePipeline, "codePipeline");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Uploads the env file for the site and starts the pipeline.
   *
   * @param stackName stack being deployed
   * @param siteMasterId site whose configuration is deployed
   * @return 200 with the pipeline execution id, or 404 if the site does not exist
   * @throws SQLException if no database connection could be borrowed
   */
  Map<String, Object> deploy(final String stackName, final String siteMasterId)
      throws SQLException {
    settings.requireDeploySettings();

    final var site = repository.getById(siteMasterId);
    if (site.isEmpty()) {
      return Responses.message(
          Responses.NOT_FOUND, "Site master %s does not exist".formatted(siteMasterId));
    }

    final var key = settings.envFileKey(stackName);
    s3.putObject(
        PutObjectRequest.builder()
            .bucket(settings.envFileBucket())
            .key(key)
            .contentType(ENV_FILE_CONTENT_TYPE)
            .build(),
        RequestBody.fromString(EnvFile.render(site.get()), StandardCharsets.UTF_8));
    logger.log(INFO, "Uploaded env file s3://{0}/{1}", settings.envFileBucket(), key);

    final var execution =
        codePipeline.startPipelineExecution(
            StartPipelineExecutionRequest.builder().name(settings.pipelineName()).build());
    logger.log(
        INFO,
        "Started pipeline {0}, execution {1}",
        settings.pipelineName(),
        execution.pipelineExecutionId());

    final var body = new LinkedHashMap<String, Object>();
    body.put("message", "Stack %s deployment started".formatted(stackName));
    body.put("stack_name", stackName);
    body.put("env_file", "s3://%s/%s".formatted(settings.envFileBucket(), key));
    body.put("pipeline_execution_id", execution.pipelineExecutionId());
    return Responses.of(Responses.SUCCESS, body);
  }
}
