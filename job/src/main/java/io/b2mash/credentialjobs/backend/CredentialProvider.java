package io.b2mash.credentialjobs.backend;

import io.b2mash.credentialjobs.task.TaskContext;
import java.util.List;

/**
 * Factory for the {@link CredentialBackend} of one third-party system. Implementations are Spring
 * beans annotated with {@link ProviderAdapter}.
 */
public interface CredentialProvider {

  String providerId();

  /** Payload fields this provider reports; at least one is required. */
  List<OutputParameter> outputParameters();

  /**
   * Resolves the provider's parameters and login secret for a task. Does not touch the third-party
   * system.
   *
   * @throws io.b2mash.credentialjobs.exception.JobConfigurationException if a parameter is missing
   *     or invalid
   * @throws io.b2mash.credentialjobs.exception.SecretFetchException if the login secret cannot be
   *     read
   */
  CredentialBackend connect(TaskContext context);
}
