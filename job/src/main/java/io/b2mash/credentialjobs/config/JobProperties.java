package io.b2mash.credentialjobs.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the job itself, as opposed to the task values injected by the orchestrator.
 *
 * @param provider slug of the credential provider this job runs, e.g. {@code postgres-role}
 * @param retry retry settings for backend calls
 * @param http timeouts for outbound HTTP calls
 */
@ConfigurationProperties(prefix = "job")
public record JobProperties(String provider, Retry retry, Http http) {

  public JobProperties {
    if (retry == null) {
      retry = new Retry(3, Duration.ofSeconds(5), Duration.ofSeconds(15));
    }
    if (http == null) {
      http = new Http(Duration.ofSeconds(10), Duration.ofSeconds(30));
    }
  }

  /**
   * @param count retries after the first attempt
   * @param minWait wait before the first retry; doubled on each further retry
   * @param maxWait upper bound for a single wait
   */
  public record Retry(int count, Duration minWait, Duration maxWait) {

    public Retry {
      if (count < 0) {
        throw new IllegalArgumentException("job.retry.count must not be negative");
      }
      if (minWait == null) {
        minWait = Duration.ofSeconds(5);
      }
      if (maxWait == null || maxWait.compareTo(minWait) < 0) {
        maxWait = minWait.compareTo(Duration.ofSeconds(15)) > 0 ? minWait : Duration.ofSeconds(15);
      }
    }
  }

  public record Http(Duration connectTimeout, Duration readTimeout) {

    public Http {
      if (connectTimeout == null) {
        connectTimeout = Duration.ofSeconds(10);
      }
      if (readTimeout == null) {
        readTimeout = Duration.ofSeconds(30);
      }
    }
  }
}
