package io.b2mash.credentialjobs.exception;

/** A required parameter is missing or invalid, or the requested provider/action is unknown. */
public class JobConfigurationException extends RuntimeException {

  public JobConfigurationException(String message) {
    super(message);
  }

  public JobConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
