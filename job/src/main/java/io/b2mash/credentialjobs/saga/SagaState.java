package io.b2mash.credentialjobs.saga;

public enum SagaState {
  START,
  CREATED,
  CREATE_FAILED,
  REVOKED,
  REVOKE_FAILED,
  REPORT_FAILED,
  COMPENSATED,
  COMPENSATION_FAILED,
  REPORTED_OK,
  REPORTED_ERROR,
  FATAL;

  public boolean isTerminal() {
    return this == REPORTED_OK || this == REPORTED_ERROR || this == FATAL;
  }
}
