package io.b2mash.credentialjobs.dispatch;

import io.b2mash.credentialjobs.config.JobProperties;
import io.b2mash.credentialjobs.saga.JobOutcome;
import io.b2mash.credentialjobs.task.TaskContext;
import io.b2mash.credentialjobs.task.TaskProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/** Processes the task once at startup and turns its outcome into the process exit code. */
@Component
public class ProvisioningJobRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(ProvisioningJobRunner.class);

  private final ActionDispatcher dispatcher;
  private final TaskProperties taskProperties;
  private final JobProperties jobProperties;

  private volatile JobOutcome outcome;

  public ProvisioningJobRunner(
      ActionDispatcher dispatcher, TaskProperties taskProperties, JobProperties jobProperties) {
    this.dispatcher = dispatcher;
    this.taskProperties = taskProperties;
    this.jobProperties = jobProperties;
  }

  @Override
  public void run(ApplicationArguments args) {
    var context = TaskContext.from(taskProperties);
    try (var ignored = TaskLoggingContext.open(context, jobProperties.provider())) {
      log.info("Processing task {} of secret {}", context.secretTaskId(), context.secretId());
      outcome = dispatcher.dispatch(context);
      switch (outcome.state()) {
        case REPORTED_OK -> log.info("Task completed successfully");
        case REPORTED_ERROR ->
            log.warn(
                "Task failed with {}: {}", outcome.errorCode().getCode(), outcome.description());
        default ->
            log.error(
                "Task ended in an unreported or uncompensated state {}: {}",
                outcome.path(),
                outcome.description());
      }
    }
  }

  @Override
  public int getExitCode() {
    return outcome == null ? 2 : outcome.exitCode();
  }

  public JobOutcome getOutcome() {
    return outcome;
  }
}
