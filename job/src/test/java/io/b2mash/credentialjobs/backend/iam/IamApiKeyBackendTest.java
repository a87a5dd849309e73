package io.b2mash.credentialjobs.backend.iam;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withNoContent;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

class IamApiKeyBackendTest {

  private static final String IAM_URL = "https://iam.cloud.ibm.com";

  private MockRestServiceServer server;
  private IamApiKeyBackend backend;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder().baseUrl(IAM_URL);
    server = MockRestServiceServer.bindTo(builder).build();
    var request =
        new IamApiKeyBackend.CreateApiKeyRequest(
            "my-secret-abcdef", "description", "iam-ServiceId-1", "account-1", false, null);
    backend = new IamApiKeyBackend(builder.build(), () -> "iam-token", new ObjectMapper(), request);
  }

  @Nested
  class Create {

    @Test
    void createsLockedApiKey() {
      server
          .expect(requestTo(IAM_URL + "/v1/apikeys"))
          .andExpect(method(HttpMethod.POST))
          .andExpect(header("Authorization", "Bearer iam-token"))
          .andExpect(header("Entity-Lock", "true"))
          .andExpect(header("Entity-Disable", "false"))
          .andExpect(
              content()
                  .json(
                      """
                      {"name": "my-secret-abcdef", "iam_id": "iam-ServiceId-1",
                       "account_id": "account-1", "support_sessions": false}
                      """))
          .andRespond(
              withSuccess(
                  """
                  {"id": "ApiKey-1", "crn": "crn:v1:apikey", "iam_id": "iam-ServiceId-1",
                   "account_id": "account-1", "apikey": "secret-value", "locked": true}
                  """,
                  MediaType.APPLICATION_JSON));

      var credential = backend.create();

      assertThat(credential.id()).isEqualTo("ApiKey-1");
      assertThat(credential.payload())
          .containsEntry("apikey", "secret-value")
          .containsEntry("id", "ApiKey-1")
          .containsEntry("crn", "crn:v1:apikey")
          .containsEntry("iam_id", "iam-ServiceId-1")
          .containsEntry("account_id", "account-1");
      server.verify();
    }

    @Test
    void omitsMissingOptionalFields() {
      server
          .expect(requestTo(IAM_URL + "/v1/apikeys"))
          .andRespond(
              withSuccess(
                  "{\"id\": \"ApiKey-1\", \"apikey\": \"secret-value\"}",
                  MediaType.APPLICATION_JSON));

      assertThat(backend.create().payload()).containsOnlyKeys("apikey", "id");
    }

    @Test
    void propagatesHttpErrors() {
      server
          .expect(requestTo(IAM_URL + "/v1/apikeys"))
          .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

      assertThatThrownBy(() -> backend.create())
          .isInstanceOf(RestClientResponseException.class)
          .hasMessageContaining("503");
    }
  }

  @Nested
  class Revoke {

    @Test
    void unlocksThenDeletes() {
      server
          .expect(requestTo(IAM_URL + "/v1/apikeys/ApiKey-1/lock"))
          .andExpect(method(HttpMethod.DELETE))
          .andRespond(withNoContent());
      server
          .expect(requestTo(IAM_URL + "/v1/apikeys/ApiKey-1"))
          .andExpect(method(HttpMethod.DELETE))
          .andExpect(header("Authorization", "Bearer iam-token"))
          .andRespond(withNoContent());

      backend.revoke("ApiKey-1");

      server.verify();
    }

    @Test
    void missingKeyIsAlreadyRevoked() {
      server
          .expect(requestTo(IAM_URL + "/v1/apikeys/ApiKey-1/lock"))
          .andRespond(
              withStatus(HttpStatus.NOT_FOUND)
                  .contentType(MediaType.APPLICATION_JSON)
                  .body(
                      """
                      {"errors": [{"code": "not_found", "message": "API key not found"}]}
                      """));

      backend.revoke("ApiKey-1");

      // no DELETE of the key itself
      server.verify();
    }

    @Test
    void notFoundWithOtherErrorCodeFails() {
      server
          .expect(requestTo(IAM_URL + "/v1/apikeys/ApiKey-1/lock"))
          .andRespond(
              withStatus(HttpStatus.NOT_FOUND)
                  .contentType(MediaType.APPLICATION_JSON)
                  .body("{\"errors\": [{\"code\": \"route_not_found\"}]}"));

      assertThatThrownBy(() -> backend.revoke("ApiKey-1"))
          .isInstanceOf(RestClientResponseException.class)
          .hasMessageContaining("IAM returned 404 when unlocking API key ApiKey-1");
      server.verify();
    }

    @Test
    void unlockErrorIsRaised() {
      server
          .expect(requestTo(IAM_URL + "/v1/apikeys/ApiKey-1/lock"))
          .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

      assertThatThrownBy(() -> backend.revoke("ApiKey-1"))
          .isInstanceOfSatisfying(
              RestClientResponseException.class,
              e -> assertThat(e.getStatusCode().value()).isEqualTo(429));
    }
  }
}
