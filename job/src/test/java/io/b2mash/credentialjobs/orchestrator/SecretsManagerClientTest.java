package io.b2mash.credentialjobs.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.ExpectedCount.never;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.b2mash.credentialjobs.auth.IamTokenClient;
import io.b2mash.credentialjobs.backend.Credential;
import io.b2mash.credentialjobs.backend.OutputParameter;
import io.b2mash.credentialjobs.exception.SecretFetchException;
import io.b2mash.credentialjobs.exception.TaskReportException;
import io.b2mash.credentialjobs.task.TaskContext;
import io.b2mash.credentialjobs.task.TaskErrorCode;
import io.b2mash.credentialjobs.task.TaskProperties;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class SecretsManagerClientTest {

  private static final String INSTANCE_URL = "https://sm.example.appdomain.cloud";
  private static final String TASK_URL =
      INSTANCE_URL + "/api/v2/secrets/secret-1/tasks/task-abcdef";
  private static final String TASK_RESPONSE =
      """
      {"id": "task-abcdef", "status": "done", "updated_by": "iam-ServiceId-123"}
      """;

  private MockRestServiceServer server;
  private IamTokenClient iamTokenClient;
  private SecretsManagerClient client;
  private final TaskContext context =
      new TaskContext(
          "secret-1",
          "task-abcdef",
          "group-1",
          "my-secret",
          null,
          null,
          "create_credentials",
          null);

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    iamTokenClient = mock(IamTokenClient.class);
    when(iamTokenClient.bearerToken("https://iam.cloud.ibm.com", "access-key"))
        .thenReturn("iam-token");
    var properties =
        new TaskProperties(
            INSTANCE_URL + "/",
            "access-key",
            "secret-1",
            "task-abcdef",
            "group-1",
            "my-secret",
            "create_credentials",
            null,
            null,
            null);
    client = new SecretsManagerClient(builder, iamTokenClient, properties);
  }

  @Test
  void fetchSecret_readsArbitraryPayload() {
    server
        .expect(requestTo(INSTANCE_URL + "/api/v2/secrets/login-1"))
        .andExpect(method(HttpMethod.GET))
        .andExpect(header("Authorization", "Bearer iam-token"))
        .andRespond(
            withSuccess(
                """
                {"id": "login-1", "secret_type": "arbitrary", "payload": "jfrog-token",
                 "versions_total": 2}
                """,
                MediaType.APPLICATION_JSON));

    var secret = client.fetchSecret("login-1", Set.of(SecretType.ARBITRARY));

    assertThat(secret.type()).isEqualTo(SecretType.ARBITRARY);
    assertThat(secret.payload()).isEqualTo("jfrog-token");
    assertThat(secret.versionsTotal()).isEqualTo(2);
    server.verify();
  }

  @Test
  void fetchSecret_readsCredentialsContentOfCustomCredentials() {
    server
        .expect(requestTo(INSTANCE_URL + "/api/v2/secrets/secret-1"))
        .andRespond(
            withSuccess(
                """
                {"id": "secret-1", "secret_type": "custom_credentials",
                 "credentials_content": {"slack_refresh_token": "xoxe-1"}}
                """,
                MediaType.APPLICATION_JSON));

    var secret = client.fetchSecret("secret-1", Set.of(SecretType.CUSTOM_CREDENTIALS));

    assertThat(secret.stringAtPath("slack_refresh_token")).contains("xoxe-1");
    assertThat(secret.versionsTotal()).isZero();
  }

  @Test
  void fetchSecret_readsPasswordOfUsernamePassword() {
    server
        .expect(requestTo(INSTANCE_URL + "/api/v2/secrets/login-1"))
        .andRespond(
            withSuccess(
                """
                {"id": "login-1", "secret_type": "username_password",
                 "username": "admin", "password": "admin-password"}
                """,
                MediaType.APPLICATION_JSON));

    var secret =
        client.fetchSecret(
            "login-1", Set.of(SecretType.ARBITRARY, SecretType.USERNAME_PASSWORD));

    assertThat(secret.type()).isEqualTo(SecretType.USERNAME_PASSWORD);
    assertThat(secret.payload()).isEqualTo("admin-password");
  }

  @Test
  void fetchSecret_wrapsFailedTokenExchange() {
    when(iamTokenClient.bearerToken("https://iam.cloud.ibm.com", "access-key"))
        .thenThrow(new IllegalStateException("IAM token response has no access_token"));

    assertThatThrownBy(() -> client.fetchSecret("login-1", Set.of(SecretType.ARBITRARY)))
        .isInstanceOf(SecretFetchException.class)
        .hasMessage("failed to read secret login-1: IAM token response has no access_token");
  }

  @Test
  void reportDeleted_wrapsFailedTokenExchange() {
    when(iamTokenClient.bearerToken("https://iam.cloud.ibm.com", "access-key"))
        .thenThrow(new IllegalStateException("IAM token response has no access_token"));

    assertThatThrownBy(() -> client.reportDeleted(context))
        .isInstanceOf(TaskReportException.class)
        .hasMessage(
            "failed to update task task-abcdef to status 'credentials_deleted': "
                + "IAM token response has no access_token")
        .hasCauseInstanceOf(IllegalStateException.class);
    server.verify();
  }

  @Test
  void fetchSecret_rejectsUnexpectedType() {
    server
        .expect(requestTo(INSTANCE_URL + "/api/v2/secrets/login-1"))
        .andRespond(
            withSuccess(
                """
                {"id": "login-1", "secret_type": "username_password"}
                """,
                MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> client.fetchSecret("login-1", Set.of(SecretType.ARBITRARY)))
        .isInstanceOf(SecretFetchException.class)
        .hasMessageContaining("has type 'username_password'")
        .hasMessageContaining("[arbitrary]");
  }

  @Test
  void fetchSecret_wrapsHttpErrors() {
    server
        .expect(requestTo(INSTANCE_URL + "/api/v2/secrets/login-1"))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThatThrownBy(() -> client.fetchSecret("login-1", Set.of(SecretType.ARBITRARY)))
        .isInstanceOf(SecretFetchException.class)
        .hasMessageContaining("failed to read secret login-1")
        .hasMessageContaining("404");
  }

  @Test
  void reportCreated_putsCredentialsCreated() {
    server
        .expect(requestTo(TASK_URL))
        .andExpect(method(HttpMethod.PUT))
        .andExpect(
            content()
                .json(
                    """
                    {"status": "credentials_created",
                     "credentials": {"id": "key-1", "payload": {"apikey": "value"}}}
                    """))
        .andRespond(withSuccess(TASK_RESPONSE, MediaType.APPLICATION_JSON));

    var ack =
        client.reportCreated(
            context,
            new Credential("key-1", Map.of("apikey", "value")),
            List.of(OutputParameter.required("apikey")));

    assertThat(ack.updatedBy()).isEqualTo("iam-ServiceId-123");
    server.verify();
  }

  @Test
  void reportCreated_rejectsInvalidPayloadWithoutCallingOrchestrator() {
    server.expect(never(), requestTo(TASK_URL));

    assertThatThrownBy(
            () ->
                client.reportCreated(
                    context,
                    new Credential("key-1", Map.of("other", "value")),
                    List.of(OutputParameter.required("apikey"))))
        .isInstanceOf(TaskReportException.class)
        .hasMessageContaining("required field 'apikey' is missing")
        .hasMessageContaining("field 'other' is not a declared output");
    server.verify();
  }

  @Test
  void reportDeleted_putsCredentialsDeleted() {
    server
        .expect(requestTo(TASK_URL))
        .andExpect(method(HttpMethod.PUT))
        .andExpect(content().json("{\"status\": \"credentials_deleted\"}", true))
        .andRespond(withSuccess(TASK_RESPONSE, MediaType.APPLICATION_JSON));

    client.reportDeleted(context);

    server.verify();
  }

  @Test
  void reportFailed_putsErrorCodeAndDescription() {
    server
        .expect(requestTo(TASK_URL))
        .andExpect(
            content()
                .json(
                    """
                    {"status": "failed",
                     "errors": [{"code": "Err10000", "description": "unknown action: 'x'"}]}
                    """,
                    true))
        .andRespond(withSuccess(TASK_RESPONSE, MediaType.APPLICATION_JSON));

    client.reportFailed(context, TaskErrorCode.UNKNOWN_ACTION, "unknown action: 'x'");

    server.verify();
  }

  @Test
  void updateTask_wrapsHttpErrors() {
    server.expect(requestTo(TASK_URL)).andRespond(withServerError());

    assertThatThrownBy(() -> client.reportDeleted(context))
        .isInstanceOf(TaskReportException.class)
        .hasMessageContaining("failed to update task task-abcdef to status 'credentials_deleted'");
  }
}
