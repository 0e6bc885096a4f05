package com.example.actionlambda.handler;

import static java.lang.System.Logger.Level.INFO;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;
import software.amazon.awssdk.services.cloudformation.model.CloudFormationException;
import software.amazon.awssdk.services.cloudformation.model.DeleteStackRequest;
import software.amazon.awssdk.services.cloudformation.model.DescribeStacksRequest;

/** Deletes a CloudFormation stack after checking that it exists. */
final class StackDestroyer {

  private static final System.Logger logger = System.getLogger(StackDestroyer.class.getName());

  private final CloudFormationClient cloudFormation;

  StackDestroyer(final CloudFormationClient cloudFormation) {
    this.cloudFormation = Objects.requireNonNull(cloudFormation, "cloudFormation");
  }

  /**
   * Starts deletion of the stack.
   *
   * @param stackName stack to delete
   * @return 200 when deletion was initiated, 404 when the stack does not exist
   * @throws CloudFormationException for any other CloudFormation failure
   */
  Map<String, Object> destroy(final String stackName) {
    try {
      cloudFormation.describeStacks(DescribeStacksRequest.builder().stackName(stackName).build());
      logger.log(INFO, "Stack {0} exists, proceeding with deletion", stackName);

      cloudFormation.deleteStack(DeleteStackRequest.builder().stackName(stackName).build());
      logger.log(INFO, "Stack {0} deletion initiated", stackName);

      final var body = new LinkedHashMap<String, Object>();
      body.put("message", "Stack %s deletion initiated successfully".formatted(stackName));
      body.put("stack_name", stackName);
      return Responses.of(Responses.SUCCESS, body);
    } catch (final CloudFormationException e) {
      logger.log(INFO, e.getMessage());
      if (!isMissingStack(e)) throw e;

      final var body = new LinkedHashMap<String, Object>();
      body.put("message", "Stack %s does not exist".formatted(stackName));
      body.put("error", e.getMessage());
      return Responses.of(Responses.NOT_FOUND, body);
    }
  }

  private static boolean isMissingStack(final CloudFormationException e) {
    return e.getMessage() != null && e.getMessage().contains("does not exist");
  }
}
