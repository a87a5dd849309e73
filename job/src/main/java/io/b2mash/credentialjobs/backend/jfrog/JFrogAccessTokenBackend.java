package io.b2mash.credentialjobs.backend.jfrog;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/** Issues and revokes JFrog access tokens through the Access REST API. */
class JFrogAccessTokenBackend implements CredentialBackend {

  private static final Logger log = LoggerFactory.getLogger(JFrogAccessTokenBackend.class);

  static final String TOKENS_PATH = "/access/api/v1/tokens";
  static final String NO_ERROR_DETAILS = "error details were not provided by JFrog";

  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private final CreateTokenRequest createRequest;

  JFrogAccessTokenBackend(
      RestClient restClient, ObjectMapper objectMapper, CreateTokenRequest createRequest) {
    this.restClient = restClient;
    this.objectMapper = objectMapper;
    this.createRequest = createRequest;
  }

  @Override
  public Credential create() {
    var token =
        restClient
            .post()
            .uri(TOKENS_PATH)
            .contentType(MediaType.APPLICATION_JSON)
            .body(createRequest)
            .retrieve()
            .onStatus(HttpStatusCode::isError, (request, response) -> throwJFrogError(response))
            .body(TokenResponse.class);
    if (token == null || token.accessToken() == null || token.tokenId() == null) {
      throw new CredentialBackendException(
          "create", "JFrog response does not contain an access token and token id");
    }
    log.info("Access token successfully created. Credentials ID: {}", token.tokenId());

    var payload = new LinkedHashMap<String, Object>();
    payload.put("access_token", token.accessToken());
    if (token.referenceToken() != null) {
      payload.put("reference_token", token.referenceToken());
    }
    return new Credential(token.tokenId(), payload);
  }

  @Override
  public void revoke(String credentialId) {
    var status =
        restClient
            .delete()
            .uri(TOKENS_PATH + "/{id}", credentialId)
            .exchange(
                (request, response) -> {
                  if (response.getStatusCode().value() == 404) {
                    return response.getStatusCode();
                  }
                  if (response.getStatusCode().isError()) {
                    throwJFrogError(response);
                  }
                  return response.getStatusCode();
                });
    if (status.value() == 404) {
      log.info("Token {} does not exist, nothing to revoke", credentialId);
    } else {
      log.info("Token {} is successfully revoked", credentialId);
    }
  }

  private void throwJFrogError(ClientHttpResponse response) throws IOException {
    var body = response.getBody().readAllBytes();
    var status = response.getStatusCode();
    throw new RestClientResponseException(
        "JFrog returned an error: Status: "
            + status.value()
            + " "
            + response.getStatusText()
            + ". Error: "
            + errorMessage(body),
        status,
        response.getStatusText(),
        response.getHeaders(),
        body,
        StandardCharsets.UTF_8);
  }

  String errorMessage(byte[] body) {
    try {
      var errors = objectMapper.readValue(body, ErrorResponse.class).errors();
      if (errors != null && !errors.isEmpty() && errors.get(0).message() != null) {
        return errors.get(0).message();
      }
      return NO_ERROR_DETAILS;
    } catch (JsonProcessingException e) {
      return "error unmarshaling JFrog response body: " + e.getOriginalMessage();
    } catch (IOException e) {
      throw new IllegalStateException("cannot read JFrog error response", e);
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record CreateTokenRequest(
      String username,
      String scope,
      @JsonProperty("expires_in") int expiresIn,
      boolean refreshable,
      String description,
      String audience,
      @JsonProperty("include_reference_token") boolean includeReferenceToken,
      @JsonProperty("grant_type") String grantType) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TokenResponse(
      @JsonProperty("token_id") String tokenId,
      @JsonProperty("access_token") String accessToken,
      @JsonProperty("reference_token") String referenceToken) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ErrorResponse(List<ErrorDetail> errors) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ErrorDetail(String code, String message) {}
}
