package io.b2mash.credentialjobs.backend.iam;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Parameters of the IAM API key provider.
 *
 * @param apikeySecretId arbitrary or custom credentials secret holding the API key used to call IAM
 * @param iamId IAM id of the user or service id that owns the created API keys
 * @param accountId account the API keys are created in
 * @param url IAM Identity Services endpoint
 * @param supportSessions whether created API keys can be used to create sessions
 * @param actionWhenLeaked what IAM does when a created key is leaked: none, disable or delete
 */
@ConfigurationProperties(prefix = "iam")
public record IamApiKeyProperties(
    @NotBlank String apikeySecretId,
    @NotBlank String iamId,
    @NotBlank String accountId,
    String url,
    boolean supportSessions,
    @Pattern(regexp = "^$|none|disable|delete") String actionWhenLeaked) {

  public static final String DEFAULT_URL = "https://iam.cloud.ibm.com";

  public IamApiKeyProperties {
    if (url == null || url.isBlank()) {
      url = DEFAULT_URL;
    }
  }
}
