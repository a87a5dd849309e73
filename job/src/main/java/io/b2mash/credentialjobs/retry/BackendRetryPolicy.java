package io.b2mash.credentialjobs.retry;

import io.b2mash.credentialjobs.config.JobProperties;
import io.b2mash.credentialjobs.exception.BackendUnavailableException;
import io.b2mash.credentialjobs.exception.CredentialBackendException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * Wraps calls to credential backends with bounded exponential backoff. Only transient failures are
 * retried; everything else surfaces on the first attempt. Orchestrator calls never go through here.
 */
@Component
public class BackendRetryPolicy {

  private static final Logger log = LoggerFactory.getLogger(BackendRetryPolicy.class);

  private final RetryTemplate retryTemplate;

  @Autowired
  public BackendRetryPolicy(JobProperties jobProperties) {
    this(jobProperties.retry(), new ThreadWaitSleeper());
  }

  public BackendRetryPolicy(JobProperties.Retry retry, Sleeper sleeper) {
    var backOff = new ExponentialBackOffPolicy();
    backOff.setInitialInterval(retry.minWait().toMillis());
    backOff.setMultiplier(2.0);
    backOff.setMaxInterval(retry.maxWait().toMillis());
    backOff.setSleeper(sleeper);

    this.retryTemplate = new RetryTemplate();
    this.retryTemplate.setRetryPolicy(new TransientFailureRetryPolicy(retry.count() + 1));
    this.retryTemplate.setBackOffPolicy(backOff);
  }

  /**
   * Runs {@code call}, retrying transient failures. Exhausted retries surface as {@link
   * BackendUnavailableException}; other failures as {@link CredentialBackendException} naming
   * {@code operation}.
   */
  public <T> T execute(String operation, Supplier<T> call) {
    var attempts = new AtomicInteger();
    RetryCallback<T, RuntimeException> callback =
        context -> {
          if (attempts.incrementAndGet() > 1) {
            log.warn(
                "Retrying {} (attempt {}) after: {}",
                operation,
                attempts.get(),
                context.getLastThrowable().getMessage());
          }
          return call.get();
        };
    try {
      return retryTemplate.execute(callback);
    } catch (RuntimeException e) {
      if (TransientFailures.isTransient(e)) {
        throw new BackendUnavailableException(operation, attempts.get(), e);
      }
      if (e instanceof CredentialBackendException backendException) {
        throw backendException;
      }
      throw new CredentialBackendException(operation, operation + " failed: " + e.getMessage(), e);
    }
  }

  public void run(String operation, Runnable call) {
    execute(
        operation,
        () -> {
          call.run();
          return null;
        });
  }
}
