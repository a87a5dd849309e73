package io.b2mash.credentialjobs.saga;

import io.b2mash.credentialjobs.task.TaskErrorCode;
import java.util.List;

/**
 * Result of one job run.
 *
 * @param state terminal state
 * @param path every state the run went through, ending with {@code state}
 * @param credentialsId credential created or deleted by the run, if any
 * @param errorCode error reported (or, when fatal, that would have been reported)
 * @param description error description; null on success
 */
public record JobOutcome(
    SagaState state,
    List<SagaState> path,
    String credentialsId,
    TaskErrorCode errorCode,
    String description) {

  public JobOutcome {
    if (!state.isTerminal()) {
      throw new IllegalArgumentException(state + " is not a terminal state");
    }
    path = List.copyOf(path);
  }

  public boolean isSuccess() {
    return state == SagaState.REPORTED_OK;
  }

  /** 0 on success, 1 when the failure was reported, 2 when it could not be. */
  public int exitCode() {
    return switch (state) {
      case REPORTED_OK -> 0;
      case REPORTED_ERROR -> 1;
      default -> 2;
    };
  }
}
