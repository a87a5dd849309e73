package io.b2mash.credentialjobs.backend.slack;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.credentialjobs.backend.Credential;
import io.b2mash.credentialjobs.backend.CredentialBackend;
import io.b2mash.credentialjobs.exception.CredentialBackendException;
import java.util.LinkedHashMap;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.client.RestClient;

/**
 * Rotates a Slack app's access token with the OAuth v2 refresh token grant. The refresh token of
 * the previous secret version is tried first; if Slack rejects it, the refresh token stored in the
 * exchange tokens secret is tried once. Refreshing leaves nothing behind to revoke.
 */
class SlackTokenBackend implements CredentialBackend {

  private static final Logger log = LoggerFactory.getLogger(SlackTokenBackend.class);

  private final RestClient restClient;
  private final SlackExchangeTokens exchangeTokens;
  private final String previousRefreshToken;
  private final Supplier<String> credentialIds;

  SlackTokenBackend(
      RestClient restClient,
      SlackExchangeTokens exchangeTokens,
      String previousRefreshToken,
      Supplier<String> credentialIds) {
    this.restClient = restClient;
    this.exchangeTokens = exchangeTokens;
    this.previousRefreshToken = previousRefreshToken;
    this.credentialIds = credentialIds;
  }

  SlackTokenBackend(
      RestClient restClient, SlackExchangeTokens exchangeTokens, String previousRefreshToken) {
    this(restClient, exchangeTokens, previousRefreshToken, () -> UUID.randomUUID().toString());
  }

  @Override
  public Credential create() {
    var fallbackToken = exchangeTokens.refreshToken();
    var refreshToken = previousRefreshToken;
    if (refreshToken == null || refreshToken.isBlank()) {
      log.info("Last refresh token not found, using the exchange tokens refresh token");
      refreshToken = fallbackToken;
    }

    OAuthResponse response;
    try {
      response = exchange(refreshToken);
    } catch (SlackRejectedException e) {
      if (refreshToken.equals(fallbackToken)) {
        throw e;
      }
      log.info("Trying again with the exchange tokens refresh token after: {}", e.getMessage());
      response = exchange(fallbackToken);
    }

    var payload = new LinkedHashMap<String, Object>();
    payload.put("slack_access_token", response.accessToken());
    payload.put("slack_refresh_token", response.refreshToken());
    return new Credential(credentialIds.get(), payload);
  }

  @Override
  public void revoke(String credentialId) {
    log.info("Slack tokens are rotated in place, nothing to revoke for {}", credentialId);
  }

  private OAuthResponse exchange(String refreshToken) {
    var form = new LinkedMultiValueMap<String, String>();
    form.add("client_id", exchangeTokens.clientId());
    form.add("client_secret", exchangeTokens.clientSecret());
    form.add("refresh_token", refreshToken);
    form.add("grant_type", "refresh_token");

    var response =
        restClient
            .post()
            .uri("/oauth.v2.access")
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .body(form)
            .retrieve()
            .body(OAuthResponse.class);
    if (response == null) {
      throw new SlackRejectedException("empty response");
    }
    if (!response.ok()) {
      throw new SlackRejectedException(response.error());
    }
    if (response.accessToken() == null || response.refreshToken() == null) {
      throw new SlackRejectedException("response does not contain both tokens");
    }
    return response;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record OAuthResponse(
      boolean ok,
      @JsonProperty("access_token") String accessToken,
      @JsonProperty("refresh_token") String refreshToken,
      String error) {}

  static class SlackRejectedException extends CredentialBackendException {

    SlackRejectedException(String error) {
      super("create", "Slack error: " + error);
    }
  }
}
