package io.b2mash.credentialjobs.backend.jfrog;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Parameters of the JFrog access token provider.
 *
 * @param baseUrl JFrog platform URL, e.g. {@code https://acme.jfrog.io}
 * @param loginSecretId arbitrary secret holding an admin access token, or username_password
 *     secret whose password is one
 * @param username user the token is issued for; the caller when empty
 * @param scope token scope
 * @param expiresInSeconds token lifetime; 0 means the platform default
 * @param refreshable whether the token can be refreshed
 * @param description token description shown in the JFrog UI
 * @param audience services the token is valid for
 * @param includeReferenceToken whether to also issue a reference token
 * @param grantType optional OAuth grant type, e.g. {@code client_credentials}
 */
@ConfigurationProperties(prefix = "jfrog")
public record JFrogAccessTokenProperties(
    @NotBlank String baseUrl,
    @NotBlank String loginSecretId,
    String username,
    String scope,
    @PositiveOrZero Integer expiresInSeconds,
    boolean refreshable,
    String description,
    String audience,
    boolean includeReferenceToken,
    String grantType) {

  public static final String DEFAULT_SCOPE = "applied-permissions/user";
  public static final int DEFAULT_EXPIRES_IN_SECONDS = 7_776_000; // 90 days
  public static final String DEFAULT_AUDIENCE = "*@*";

  public JFrogAccessTokenProperties {
    if (baseUrl != null && baseUrl.endsWith("/")) {
      baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
    }
    if (scope == null || scope.isBlank()) {
      scope = DEFAULT_SCOPE;
    }
    if (expiresInSeconds == null || expiresInSeconds == 0) {
      expiresInSeconds = DEFAULT_EXPIRES_IN_SECONDS;
    }
    if (audience == null || audience.isBlank()) {
      audience = DEFAULT_AUDIENCE;
    }
  }
}
