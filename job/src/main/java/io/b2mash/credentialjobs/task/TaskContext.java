package io.b2mash.credentialjobs.task;

import java.util.Optional;

/**
 * Immutable per-run view of the task being processed. The credentials id is only present on delete
 * tasks, or after a successful create.
 */
public record TaskContext(
    String secretId,
    String secretTaskId,
    String secretGroupId,
    String secretName,
    String secretVersionId,
    String trigger,
    String action,
    String credentialsId) {

  public static TaskContext from(TaskProperties properties) {
    return new TaskContext(
        properties.secretId(),
        properties.secretTaskId(),
        properties.secretGroupId(),
        properties.secretName(),
        blankToNull(properties.secretVersionId()),
        blankToNull(properties.trigger()),
        properties.action(),
        blankToNull(properties.credentialsId()));
  }

  public TaskContext withCredentialsId(String id) {
    return new TaskContext(
        secretId, secretTaskId, secretGroupId, secretName, secretVersionId, trigger, action, id);
  }

  public Optional<String> findCredentialsId() {
    return Optional.ofNullable(credentialsId);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
