package io.b2mash.credentialjobs.retry;

import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

/** Retries up to a fixed number of attempts, as long as each failure is transient. */
class TransientFailureRetryPolicy extends SimpleRetryPolicy {

  TransientFailureRetryPolicy(int maxAttempts) {
    super(maxAttempts);
  }

  @Override
  public boolean canRetry(RetryContext context) {
    var last = context.getLastThrowable();
    return (last == null || TransientFailures.isTransient(last))
        && context.getRetryCount() < getMaxAttempts();
  }
}
