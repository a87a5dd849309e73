package io.b2mash.credentialjobs.backend.slack;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Parameters of the Slack token rotation provider.
 *
 * @param exchangeTokensSecretId arbitrary secret with the app's client id, client secret and
 *     initial refresh token, as JSON
 * @param apiUrl Slack Web API base URL
 */
@ConfigurationProperties(prefix = "slack")
public record SlackTokenProperties(@NotBlank String exchangeTokensSecretId, String apiUrl) {

  public static final String DEFAULT_API_URL = "https://slack.com/api";

  public SlackTokenProperties {
    if (apiUrl == null || apiUrl.isBlank()) {
      apiUrl = DEFAULT_API_URL;
    }
  }
}
