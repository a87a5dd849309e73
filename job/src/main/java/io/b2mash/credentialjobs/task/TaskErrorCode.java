package io.b2mash.credentialjobs.task;

/** Stable error codes attached to a failed task so its owner can tell failure classes apart. */
public enum TaskErrorCode {
  UNKNOWN_ACTION("Err10000"),
  CONFIGURATION_INVALID("Err10001"),
  SECRET_FETCH_FAILED("Err10002"),
  BACKEND_UNAVAILABLE("Err10003"),
  CREATE_FAILED("Err10004"),
  DELETE_FAILED("Err10005"),
  REPORT_FAILED_ROLLED_BACK("Err10006"),
  // Never reported: the orchestrator could not be reached when this happens.
  ROLLBACK_FAILED("Err10007");

  private final String code;

  TaskErrorCode(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
