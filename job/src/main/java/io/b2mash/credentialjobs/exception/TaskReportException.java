package io.b2mash.credentialjobs.exception;

/** Updating the task in the orchestrator failed, or the update was rejected. */
public class TaskReportException extends RuntimeException {

  public TaskReportException(String message) {
    super(message);
  }

  public TaskReportException(String message, Throwable cause) {
    super(message, cause);
  }
}
