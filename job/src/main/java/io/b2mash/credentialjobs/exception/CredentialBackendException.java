package io.b2mash.credentialjobs.exception;

/**
 * A credential backend rejected or failed an operation. The message names the operation (and the
 * credential id where there is one) so it can be reported to the owner of the secret as-is.
 */
public class CredentialBackendException extends RuntimeException {

  private final String operation;

  public CredentialBackendException(String operation, String message) {
    super(message);
    this.operation = operation;
  }

  public CredentialBackendException(String operation, String message, Throwable cause) {
    super(message, cause);
    this.operation = operation;
  }

  public String getOperation() {
    return operation;
  }
}
