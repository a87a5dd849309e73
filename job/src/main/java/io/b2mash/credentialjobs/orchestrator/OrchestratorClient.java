package io.b2mash.credentialjobs.orchestrator;

import io.b2mash.credentialjobs.backend.Credential;
import io.b2mash.credentialjobs.backend.OutputParameter;
import io.b2mash.credentialjobs.exception.SecretFetchException;
import io.b2mash.credentialjobs.exception.TaskReportException;
import io.b2mash.credentialjobs.task.TaskContext;
import io.b2mash.credentialjobs.task.TaskErrorCode;
import java.util.List;
import java.util.Set;

/**
 * Port to the secrets lifecycle orchestrator. Calls are single-attempt: a failed report ends the
 * run.
 */
public interface OrchestratorClient {

  /**
   * Reads a secret and checks it is one of {@code expectedTypes}.
   *
   * @throws SecretFetchException if the secret cannot be read or has another type
   */
  SecretValue fetchSecret(String secretId, Set<SecretType> expectedTypes);

  /**
   * Marks the task as having created {@code credential}. The payload is checked against {@code
   * outputParameters} first; a payload that does not match is rejected like a failed call.
   *
   * @throws TaskReportException if the payload is invalid or the update fails
   */
  TaskAcknowledgement reportCreated(
      TaskContext context, Credential credential, List<OutputParameter> outputParameters);

  /** @throws TaskReportException if the update fails */
  TaskAcknowledgement reportDeleted(TaskContext context);

  /** @throws TaskReportException if the update fails */
  TaskAcknowledgement reportFailed(TaskContext context, TaskErrorCode code, String description);
}
