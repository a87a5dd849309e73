package io.b2mash.credentialjobs.backend.slack;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.credentialjobs.backend.ParameterValidator;
import io.b2mash.credentialjobs.exception.JobConfigurationException;
import io.b2mash.credentialjobs.exception.SecretFetchException;
import io.b2mash.credentialjobs.orchestrator.OrchestratorClient;
import io.b2mash.credentialjobs.orchestrator.SecretType;
import io.b2mash.credentialjobs.orchestrator.SecretValue;
import io.b2mash.credentialjobs.task.TaskContext;
import jakarta.validation.Validation;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

class SlackTokenProviderTest {

  private final TaskContext context =
      new TaskContext(
          "secret-1", "task-abcdef", "group-1", "slack", null, null, "create_credentials", null);

  private OrchestratorClient orchestrator;
  private ParameterValidator parameterValidator;

  @BeforeEach
  void setUp() {
    orchestrator = mock(OrchestratorClient.class);
    parameterValidator =
        new ParameterValidator(Validation.buildDefaultValidatorFactory().getValidator());
  }

  private SlackTokenProvider provider(String exchangeTokensSecretId) {
    return new SlackTokenProvider(
        new SlackTokenProperties(exchangeTokensSecretId, null),
        parameterValidator,
        orchestrator,
        RestClient.builder(),
        new ObjectMapper());
  }

  @Test
  void connect_rejectsMissingExchangeTokensSecret() {
    assertThatThrownBy(() -> provider("").connect(context))
        .isInstanceOf(JobConfigurationException.class)
        .hasMessageContaining("slack.exchangeTokensSecretId");
    verify(orchestrator, never()).fetchSecret(any(), any());
  }

  @Test
  void connect_rejectsExchangeTokensThatAreNotJson() {
    when(orchestrator.fetchSecret("exchange-1", Set.of(SecretType.ARBITRARY)))
        .thenReturn(new SecretValue("exchange-1", SecretType.ARBITRARY, "not json", null, 1));

    assertThatThrownBy(() -> provider("exchange-1").connect(context))
        .isInstanceOf(SecretFetchException.class)
        .hasMessageContaining("is not valid JSON");
  }

  @Test
  void connect_rejectsIncompleteExchangeTokens() {
    when(orchestrator.fetchSecret("exchange-1", Set.of(SecretType.ARBITRARY)))
        .thenReturn(
            new SecretValue(
                "exchange-1", SecretType.ARBITRARY, "{\"client_id\": \"c\"}", null, 1));

    assertThatThrownBy(() -> provider("exchange-1").connect(context))
        .isInstanceOf(SecretFetchException.class)
        .hasMessageContaining("must contain client_id, client_secret and refresh_token");
  }

  @Test
  void connect_toleratesUnreadablePreviousVersion() {
    when(orchestrator.fetchSecret("exchange-1", Set.of(SecretType.ARBITRARY)))
        .thenReturn(
            new SecretValue(
                "exchange-1",
                SecretType.ARBITRARY,
                """
                {"client_id": "c", "client_secret": "s", "refresh_token": "r"}
                """,
                null,
                1));
    when(orchestrator.fetchSecret(eq("secret-1"), any()))
        .thenThrow(new SecretFetchException("secret-1", "not found"));

    assertThat(provider("exchange-1").connect(context)).isInstanceOf(SlackTokenBackend.class);
  }
}
