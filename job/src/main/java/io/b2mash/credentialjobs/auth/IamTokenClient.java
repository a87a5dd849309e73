package io.b2mash.credentialjobs.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.client.RestClient;

/**
 * Exchanges IBM Cloud API keys for IAM bearer tokens. Tokens are cached for less than their
 * one-hour lifetime, keyed by endpoint and API key, so a run exchanges each key at most once.
 */
@Component
public class IamTokenClient {

  private static final Logger log = LoggerFactory.getLogger(IamTokenClient.class);
  static final String GRANT_TYPE = "urn:ibm:params:oauth:grant-type:apikey";

  private final RestClient restClient;

  // "iamUrl|apikey" -> access token
  private final Cache<String, String> tokenCache =
      Caffeine.newBuilder().expireAfterWrite(Duration.ofMinutes(50)).maximumSize(16).build();

  public IamTokenClient(RestClient.Builder restClientBuilder) {
    this.restClient = restClientBuilder.build();
  }

  /** Returns a bearer token for {@code apiKey}; transport and HTTP errors propagate unchanged. */
  public String bearerToken(String iamUrl, String apiKey) {
    return tokenCache.get(iamUrl + "|" + apiKey, k -> exchange(iamUrl, apiKey));
  }

  private String exchange(String iamUrl, String apiKey) {
    var form = new LinkedMultiValueMap<String, String>();
    form.add("grant_type", GRANT_TYPE);
    form.add("apikey", apiKey);

    var response =
        restClient
            .post()
            .uri(iamUrl + "/identity/token")
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .accept(MediaType.APPLICATION_JSON)
            .body(form)
            .retrieve()
            .body(TokenResponse.class);
    if (response == null || response.accessToken() == null || response.accessToken().isBlank()) {
      throw new IllegalStateException("IAM token response from " + iamUrl + " has no access_token");
    }
    log.debug("Obtained IAM token from {}, expires in {}s", iamUrl, response.expiresIn());
    return response.accessToken();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TokenResponse(
      @JsonProperty("access_token") String accessToken,
      @JsonProperty("expires_in") Long expiresIn) {}
}
