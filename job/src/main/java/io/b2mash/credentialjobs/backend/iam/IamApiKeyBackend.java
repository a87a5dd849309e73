package io.b2mash.credentialjobs.backend.iam;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.credentialjobs.backend.Credential;
import io.b2mash.credentialjobs.backend.CredentialBackend;
import io.b2mash.credentialjobs.exception.CredentialBackendException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Creates IAM API keys locked and enabled, and deletes them by unlocking first. A key that IAM
 * reports as not found counts as already revoked.
 */
class IamApiKeyBackend implements CredentialBackend {

  private static final Logger log = LoggerFactory.getLogger(IamApiKeyBackend.class);

  private final RestClient restClient;
  private final Supplier<String> bearerToken;
  private final ObjectMapper objectMapper;
  private final CreateApiKeyRequest createRequest;

  IamApiKeyBackend(
      RestClient restClient,
      Supplier<String> bearerToken,
      ObjectMapper objectMapper,
      CreateApiKeyRequest createRequest) {
    this.restClient = restClient;
    this.bearerToken = bearerToken;
    this.objectMapper = objectMapper;
    this.createRequest = createRequest;
  }

  @Override
  public Credential create() {
    var apiKey =
        restClient
            .post()
            .uri("/v1/apikeys")
            .headers(h -> h.setBearerAuth(bearerToken.get()))
            .header("Entity-Lock", "true")
            .header("Entity-Disable", "false")
            .contentType(MediaType.APPLICATION_JSON)
            .body(createRequest)
            .retrieve()
            .body(ApiKeyResponse.class);
    if (apiKey == null || apiKey.id() == null || apiKey.apikey() == null) {
      throw new CredentialBackendException(
          "create", "IAM returned no API key for '" + createRequest.name() + "'");
    }
    log.info("API key with id '{}' was created", apiKey.id());

    var payload = new LinkedHashMap<String, Object>();
    payload.put("apikey", apiKey.apikey());
    payload.put("id", apiKey.id());
    putIfPresent(payload, "crn", apiKey.crn());
    putIfPresent(payload, "iam_id", apiKey.iamId());
    putIfPresent(payload, "account_id", apiKey.accountId());
    return new Credential(apiKey.id(), payload);
  }

  @Override
  public void revoke(String credentialId) {
    if (!unlock(credentialId)) {
      log.info("API key with id '{}' does not exist, nothing to revoke", credentialId);
      return;
    }
    restClient
        .delete()
        .uri("/v1/apikeys/{id}", credentialId)
        .headers(h -> h.setBearerAuth(bearerToken.get()))
        .retrieve()
        .toBodilessEntity();
    log.info("API key with id '{}' was deleted", credentialId);
  }

  /** Unlocks the API key; returns false when IAM does not know the key. */
  private boolean unlock(String credentialId) {
    return restClient
        .delete()
        .uri("/v1/apikeys/{id}/lock", credentialId)
        .headers(h -> h.setBearerAuth(bearerToken.get()))
        .exchange(
            (request, response) -> {
              var status = response.getStatusCode();
              if (status.value() == 204) {
                return true;
              }
              var body = response.getBody().readAllBytes();
              if (status.value() == 404 && isNotFound(body)) {
                return false;
              }
              if (status.isError()) {
                throw new RestClientResponseException(
                    "IAM returned " + status.value() + " when unlocking API key " + credentialId,
                    status,
                    response.getStatusText(),
                    response.getHeaders(),
                    body,
                    StandardCharsets.UTF_8);
              }
              throw new CredentialBackendException(
                  "revoke",
                  "unexpected "
                      + status.value()
                      + " response from IAM when attempting to unlock API key "
                      + credentialId);
            });
  }

  // IAM signals a missing key with exactly one error whose code is "not_found".
  private boolean isNotFound(byte[] body) {
    try {
      var errors = objectMapper.readValue(body, ErrorResponse.class).errors();
      return errors != null && errors.size() == 1 && "not_found".equals(errors.get(0).code());
    } catch (JsonProcessingException e) {
      log.debug("IAM 404 body is not an error document: {}", e.getOriginalMessage());
      return false;
    } catch (IOException e) {
      throw new IllegalStateException("cannot read IAM error response", e);
    }
  }

  private static void putIfPresent(Map<String, Object> payload, String key, String value) {
    if (value != null) {
      payload.put(key, value);
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record CreateApiKeyRequest(
      String name,
      String description,
      @JsonProperty("iam_id") String iamId,
      @JsonProperty("account_id") String accountId,
      @JsonProperty("support_sessions") boolean supportSessions,
      @JsonProperty("action_when_leaked") String actionWhenLeaked) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ApiKeyResponse(
      String id,
      String crn,
      @JsonProperty("iam_id") String iamId,
      @JsonProperty("account_id") String accountId,
      String apikey) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ErrorResponse(List<ErrorDetail> errors) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ErrorDetail(String code, String message) {}
}
