package io.b2mash.credentialjobs.exception;

/** The login secret referenced by the task could not be read, or has an unexpected type. */
public class SecretFetchException extends RuntimeException {

  private final String secretId;

  public SecretFetchException(String secretId, String message) {
    super(message);
    this.secretId = secretId;
  }

  public SecretFetchException(String secretId, String message, Throwable cause) {
    super(message, cause);
    this.secretId = secretId;
  }

  public String getSecretId() {
    return secretId;
  }
}
