package io.b2mash.credentialjobs.exception;

/** Transient backend failures persisted after every retry attempt was used up. */
public class BackendUnavailableException extends CredentialBackendException {

  private final int attempts;

  public BackendUnavailableException(String operation, int attempts, Throwable cause) {
    super(
        operation,
        operation + " failed after " + attempts + " attempts: " + cause.getMessage(),
        cause);
    this.attempts = attempts;
  }

  public int getAttempts() {
    return attempts;
  }
}
