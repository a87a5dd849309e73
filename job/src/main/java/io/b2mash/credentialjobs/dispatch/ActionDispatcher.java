package io.b2mash.credentialjobs.dispatch;

import io.b2mash.credentialjobs.backend.CredentialProvider;
import io.b2mash.credentialjobs.backend.CredentialProviderRegistry;
import io.b2mash.credentialjobs.config.JobProperties;
import io.b2mash.credentialjobs.exception.JobConfigurationException;
import io.b2mash.credentialjobs.saga.JobOutcome;
import io.b2mash.credentialjobs.saga.ProvisioningSaga;
import io.b2mash.credentialjobs.task.TaskAction;
import io.b2mash.credentialjobs.task.TaskContext;
import io.b2mash.credentialjobs.task.TaskErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs exactly one saga path for the task's action. An unknown action is reported before the
 * provider is resolved, so it never reaches a backend.
 */
@Service
public class ActionDispatcher {

  private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

  private final CredentialProviderRegistry providerRegistry;
  private final ProvisioningSaga saga;
  private final JobProperties jobProperties;

  public ActionDispatcher(
      CredentialProviderRegistry providerRegistry,
      ProvisioningSaga saga,
      JobProperties jobProperties) {
    this.providerRegistry = providerRegistry;
    this.saga = saga;
    this.jobProperties = jobProperties;
  }

  public JobOutcome dispatch(TaskContext context) {
    var action = TaskAction.fromSelector(context.action());
    if (action.isEmpty()) {
      log.error("Unknown action '{}'", context.action());
      return saga.reject(
          context, TaskErrorCode.UNKNOWN_ACTION, "unknown action: '" + context.action() + "'");
    }

    CredentialProvider provider;
    try {
      provider = providerRegistry.resolve(jobProperties.provider());
    } catch (JobConfigurationException e) {
      log.error("Cannot resolve credential provider: {}", e.getMessage());
      return saga.reject(context, TaskErrorCode.CONFIGURATION_INVALID, e.getMessage());
    }

    log.info("Running {} with provider {}", action.get().getSelector(), provider.providerId());
    return switch (action.get()) {
      case CREATE -> saga.create(provider, context);
      case DELETE -> saga.delete(provider, context);
    };
  }
}
