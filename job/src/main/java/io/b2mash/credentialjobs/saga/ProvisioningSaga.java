package io.b2mash.credentialjobs.saga;

import io.b2mash.credentialjobs.backend.Credential;
import io.b2mash.credentialjobs.backend.CredentialBackend;
import io.b2mash.credentialjobs.backend.CredentialProvider;
import io.b2mash.credentialjobs.exception.BackendUnavailableException;
import io.b2mash.credentialjobs.exception.CredentialBackendException;
import io.b2mash.credentialjobs.exception.JobConfigurationException;
import io.b2mash.credentialjobs.exception.SecretFetchException;
import io.b2mash.credentialjobs.orchestrator.OrchestratorClient;
import io.b2mash.credentialjobs.retry.BackendRetryPolicy;
import io.b2mash.credentialjobs.task.TaskContext;
import io.b2mash.credentialjobs.task.TaskErrorCode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the create and delete paths of a task against one credential backend.
 *
 * <p>Create: create the credential, report it, and revoke it again if the report fails. The
 * revoke is attempted at most once, and only for a credential whose creation succeeded. If it
 * fails too, the run ends {@link SagaState#FATAL} without another report, since an orphaned
 * credential may exist and the orchestrator is not accepting updates.
 *
 * <p>Delete: revoke (which succeeds for credentials that are already gone), then report.
 *
 * <p>Backend calls go through {@link BackendRetryPolicy}; orchestrator calls are made once. Any
 * exception from a report counts as a failed report, so a created credential is never left
 * unreported and unrevoked.
 */
@Service
public class ProvisioningSaga {

  private static final Logger log = LoggerFactory.getLogger(ProvisioningSaga.class);

  private final OrchestratorClient orchestratorClient;
  private final BackendRetryPolicy retryPolicy;

  public ProvisioningSaga(OrchestratorClient orchestratorClient, BackendRetryPolicy retryPolicy) {
    this.orchestratorClient = orchestratorClient;
    this.retryPolicy = retryPolicy;
  }

  public JobOutcome create(CredentialProvider provider, TaskContext context) {
    var run = new Run(context);
    CredentialBackend backend;
    try {
      backend = provider.connect(context);
    } catch (JobConfigurationException e) {
      return run.fail(TaskErrorCode.CONFIGURATION_INVALID, e.getMessage());
    } catch (SecretFetchException e) {
      return run.fail(TaskErrorCode.SECRET_FETCH_FAILED, e.getMessage());
    } catch (RuntimeException e) {
      log.error("Cannot prepare the credentials backend: {}", e.getMessage(), e);
      return run.fail(
          TaskErrorCode.CONFIGURATION_INVALID,
          "cannot prepare the credentials backend: " + e.getMessage());
    }

    try {
      Credential credential;
      try {
        credential = retryPolicy.execute("create credentials", backend::create);
      } catch (CredentialBackendException e) {
        log.error("Error creating credentials: {}", e.getMessage(), e);
        run.enter(SagaState.CREATE_FAILED);
        return run.fail(
            codeFor(e, TaskErrorCode.CREATE_FAILED),
            "cannot create credentials: " + e.getMessage());
      }

      run.created(credential.id());
      try {
        var ack =
            orchestratorClient.reportCreated(
                run.context, credential, provider.outputParameters());
        log.info(
            "Task successfully updated: credentials with id '{}' were created by: {}",
            credential.id(),
            ack.updatedBy());
        return run.finish(SagaState.REPORTED_OK, null, null);
      } catch (RuntimeException reportError) {
        run.enter(SagaState.REPORT_FAILED);
        return compensate(run, backend, credential.id(), reportError);
      }
    } finally {
      backend.close();
    }
  }

  public JobOutcome delete(CredentialProvider provider, TaskContext context) {
    var run = new Run(context);
    var credentialsId = context.credentialsId();
    if (credentialsId == null) {
      return run.fail(
          TaskErrorCode.CONFIGURATION_INVALID,
          "a credentials id is required to delete credentials");
    }

    CredentialBackend backend;
    try {
      backend = provider.connect(context);
    } catch (JobConfigurationException e) {
      return run.fail(TaskErrorCode.CONFIGURATION_INVALID, e.getMessage());
    } catch (SecretFetchException e) {
      return run.fail(TaskErrorCode.SECRET_FETCH_FAILED, e.getMessage());
    } catch (RuntimeException e) {
      log.error("Cannot prepare the credentials backend: {}", e.getMessage(), e);
      return run.fail(
          TaskErrorCode.CONFIGURATION_INVALID,
          "cannot prepare the credentials backend: " + e.getMessage());
    }

    try {
      try {
        retryPolicy.run("revoke credentials " + credentialsId, () -> backend.revoke(credentialsId));
      } catch (CredentialBackendException e) {
        log.error("Error revoking credentials: {}", e.getMessage(), e);
        run.enter(SagaState.REVOKE_FAILED);
        return run.fail(
            codeFor(e, TaskErrorCode.DELETE_FAILED),
            "error revoking credentials with credentials id '"
                + credentialsId
                + "': "
                + e.getMessage());
      }
      run.enter(SagaState.REVOKED);

      try {
        var ack = orchestratorClient.reportDeleted(context);
        log.info(
            "Task successfully updated: credentials with id '{}' were deleted by: {}",
            credentialsId,
            ack.updatedBy());
        return run.finish(SagaState.REPORTED_OK, null, null);
      } catch (RuntimeException e) {
        log.error(
            "Cannot update task about deleted credentials with id '{}': {}",
            credentialsId,
            e.getMessage(),
            e);
        return run.finish(SagaState.FATAL, null, "cannot update task: " + e.getMessage());
      }
    } finally {
      backend.close();
    }
  }

  /** Reports a task that was rejected before any provider was involved. */
  public JobOutcome reject(TaskContext context, TaskErrorCode code, String description) {
    return new Run(context).fail(code, description);
  }

  private JobOutcome compensate(
      Run run, CredentialBackend backend, String credentialsId, RuntimeException reportError) {
    log.error(
        "Cannot update task about created credentials with id '{}', revoking them: {}",
        credentialsId,
        reportError.getMessage());
    try {
      retryPolicy.run("revoke credentials " + credentialsId, () -> backend.revoke(credentialsId));
    } catch (CredentialBackendException revokeError) {
      run.enter(SagaState.COMPENSATION_FAILED);
      var description =
          "cannot update task: "
              + reportError.getMessage()
              + ". cannot revoke the credentials with id '"
              + credentialsId
              + "': "
              + revokeError.getMessage();
      log.error(
          "Credentials with id '{}' may be orphaned and need to be removed manually. {}",
          credentialsId,
          description,
          revokeError);
      return run.finish(SagaState.FATAL, TaskErrorCode.ROLLBACK_FAILED, description);
    }
    run.enter(SagaState.COMPENSATED);
    log.info("Credentials with id '{}' were revoked", credentialsId);
    return run.fail(
        TaskErrorCode.REPORT_FAILED_ROLLED_BACK,
        "cannot update task: "
            + reportError.getMessage()
            + ". credentials with id '"
            + credentialsId
            + "' were revoked");
  }

  private static TaskErrorCode codeFor(CredentialBackendException e, TaskErrorCode otherwise) {
    return e instanceof BackendUnavailableException ? TaskErrorCode.BACKEND_UNAVAILABLE : otherwise;
  }

  /** Mutable bookkeeping for one run: the context, and the states it has passed through. */
  private final class Run {

    private TaskContext context;
    private final List<SagaState> path = new ArrayList<>(List.of(SagaState.START));

    Run(TaskContext context) {
      this.context = context;
    }

    void enter(SagaState state) {
      path.add(state);
    }

    void created(String credentialsId) {
      context = context.withCredentialsId(credentialsId);
      enter(SagaState.CREATED);
    }

    /** Reports the failure; the run is fatal if the report itself fails. */
    JobOutcome fail(TaskErrorCode code, String description) {
      try {
        var ack = orchestratorClient.reportFailed(context, code, description);
        log.info(
            "Updated task about error with code '{}' and description '{}' by: {}",
            code.getCode(),
            description,
            ack.updatedBy());
        return finish(SagaState.REPORTED_ERROR, code, description);
      } catch (RuntimeException e) {
        log.error(
            "Cannot update task about error with code '{}' and description '{}': {}",
            code.getCode(),
            description,
            e.getMessage(),
            e);
        return finish(SagaState.FATAL, code, description);
      }
    }

    JobOutcome finish(SagaState terminal, TaskErrorCode code, String description) {
      enter(terminal);
      return new JobOutcome(terminal, path, context.credentialsId(), code, description);
    }
  }
}
