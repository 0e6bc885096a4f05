package com.example.actionlambda.handler;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.example.actionlambda.core.error.ClassifiedException;
import com.example.actionlambda.core.jdbc.ConnectionPoolManager;
import com.example.actionlambda.core.repository.SiteMasterRepository;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;
import software.amazon.awssdk.services.codepipeline.CodePipelineClient;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Lambda entry point that deploys or destroys a tenant stack.
 *
 * <p>Event:
 *
 * <pre>{@code
 * {"action": "deploy", "stack_name": "tenant-a", "site_master_id": "site-42"}
 * {"action": "destroy", "stack_name": "tenant-a"}
 * }</pre>
 *
 * <p>Responses are {@code {"statusCode": int, "body": "<json>"}}. Database failures report the
 * policy flags of their {@link ClassifiedException} in the body so the caller can decide on
 * retries, alerts and dead-lettering.
 *
 * <p>The connection pool lives as long as the handler instance, i.e. across warm invocations of
 * the same Lambda container.
 */
public class StackActionHandler implements RequestHandler<Map<String, Object>, Map<String, Object>> {

  private static final System.Logger logger = System.getLogger(StackActionHandler.class.getName());

  private final StackDeployer deployer;
  private final StackDestroyer destroyer;

  /** Handler wired from the environment, used by the Lambda runtime. */
  public StackActionHandler() {
    this(
        new SiteMasterRepository(new ConnectionPoolManager()),
        CloudFormationClient.create(),
        S3Client.create(),
        CodePipelineClient.create(),
        HandlerSettings.fromEnvironment());
  }

  /**
   * Handler with explicit collaborators.
   *
   * @param repository site master lookup
   * @param cloudFormation CloudFormation client for destroy
   * @param s3 S3 client receiving env files
   * @param codePipeline CodePipeline client starting deployments
   * @param settings bucket and pipeline configuration
   */
  public StackActionHandler(
      final SiteMasterRepository repository,
      final CloudFormationClient cloudFormation,
      final S3Client s3,
      final CodePipelineClient codePipeline,
      final HandlerSettings settings) {
    this.deployer = new StackDeployer(repository, s3, codePipeline, settings);
    this.destroyer = new StackDestroyer(cloudFormation);
  }

  @Override
  public Map<String, Object> handleRequest(final Map<String, Object> event, final Context context) {
    final var request = ActionRequest.from(event);
    logger.log(
        INFO,
        "[Action: {0}], [Stack Name: {1}], [Site Master ID: {2}]",
        request.action(),
        request.stackName(),
        request.siteMasterId());

    final var action = Action.parse(request.action());
    if (action.isEmpty()) {
      logger.log(ERROR, "Invalid action: {0}", request.action());
      return Responses.message(
          Responses.BAD_REQUEST,
          "Invalid action. Use \"deploy\" or \"destroy\" in the request body");
    }

    final var stackName = request.stackNameIfPresent();
    if (stackName.isEmpty()) {
      return Responses.message(Responses.BAD_REQUEST, "stack_name is required in request body");
    }

    try {
      return switch (action.get()) {
        case DEPLOY -> deploy(stackName.get(), request);
        case DESTROY -> destroyer.destroy(stackName.get());
      };
    } catch (final ClassifiedException e) {
      logger.log(ERROR, "Error during stack " + action.get().value() + ": " + e.getMessage(), e);
      final var body = failureBody(action.get(), e);
      body.put("kind", e.kind().name());
      body.put("retry", e.policy().retry());
      body.put("send_alert", e.policy().sendAlert());
      body.put("send_to_dlq", e.policy().sendToDeadLetter());
      body.put("insert_to_api_error_history", e.policy().recordInHistory());
      return Responses.of(Responses.INTERNAL_SERVER_ERROR, body);
    } catch (final Exception e) {
      logger.log(ERROR, "Error during stack " + action.get().value() + ": " + e.getMessage(), e);
      return Responses.of(Responses.INTERNAL_SERVER_ERROR, failureBody(action.get(), e));
    }
  }

  private Map<String, Object> deploy(final String stackName, final ActionRequest request)
      throws SQLException {
    final var siteMasterId = request.siteMasterIdIfPresent();
    if (siteMasterId.isEmpty()) {
      return Responses.message(
          Responses.BAD_REQUEST, "site_master_id is required in request body");
    }
    return deployer.deploy(stackName, siteMasterId.get());
  }

  private static Map<String, Object> failureBody(final Action action, final Exception e) {
    final var body = new LinkedHashMap<String, Object>();
    body.put(
        "message", action == Action.DEPLOY ? "Stack deployment failed" : "Stack deletion failed");
    body.put("error", String.valueOf(e.getMessage()));
    return body;
  }
}
