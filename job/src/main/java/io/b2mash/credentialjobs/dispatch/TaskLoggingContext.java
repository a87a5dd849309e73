package io.b2mash.credentialjobs.dispatch;

import io.b2mash.credentialjobs.task.TaskContext;
import org.slf4j.MDC;

/** Puts the identity of the running task into the MDC until closed. */
final class TaskLoggingContext implements AutoCloseable {

  static final String MDC_SECRET_TASK_ID = "secretTaskId";
  static final String MDC_ACTION = "action";
  static final String MDC_SECRET_ID = "secretId";
  static final String MDC_PROVIDER = "provider";

  private TaskLoggingContext() {}

  static TaskLoggingContext open(TaskContext context, String provider) {
    MDC.put(MDC_SECRET_TASK_ID, context.secretTaskId());
    MDC.put(MDC_ACTION, context.action());
    MDC.put(MDC_SECRET_ID, context.secretId());
    if (provider != null) {
      MDC.put(MDC_PROVIDER, provider);
    }
    return new TaskLoggingContext();
  }

  @Override
  public void close() {
    MDC.remove(MDC_SECRET_TASK_ID);
    MDC.remove(MDC_ACTION);
    MDC.remove(MDC_SECRET_ID);
    MDC.remove(MDC_PROVIDER);
  }
}
