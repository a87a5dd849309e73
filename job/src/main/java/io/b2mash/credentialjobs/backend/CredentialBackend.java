package io.b2mash.credentialjobs.backend;

/**
 * A connected third-party system that can create and revoke credentials. Instances are bound to a
 * single task run and closed when the run ends.
 */
public interface CredentialBackend extends AutoCloseable {

  /** Creates a new credential. Called at most once per run, not counting retries. */
  Credential create();

  /**
   * Revokes the credential with the given id. Succeeds without doing anything when the credential
   * does not exist.
   */
  void revoke(String credentialId);

  @Override
  default void close() {}
}
