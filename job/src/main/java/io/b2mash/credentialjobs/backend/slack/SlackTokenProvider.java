package io.b2mash.credentialjobs.backend.slack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.credentialjobs.backend.CredentialBackend;
import io.b2mash.credentialjobs.backend.CredentialProvider;
import io.b2mash.credentialjobs.backend.OutputParameter;
import io.b2mash.credentialjobs.backend.ParameterValidator;
import io.b2mash.credentialjobs.backend.ProviderAdapter;
import io.b2mash.credentialjobs.exception.SecretFetchException;
import io.b2mash.credentialjobs.orchestrator.OrchestratorClient;
import io.b2mash.credentialjobs.orchestrator.SecretType;
import io.b2mash.credentialjobs.task.TaskContext;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
@ProviderAdapter(slug = "slack-oauth")
public class SlackTokenProvider implements CredentialProvider {

  private static final Logger log = LoggerFactory.getLogger(SlackTokenProvider.class);

  static final List<OutputParameter> OUTPUTS =
      List.of(
          OutputParameter.required("slack_access_token"),
          OutputParameter.required("slack_refresh_token"));

  private final SlackTokenProperties properties;
  private final ParameterValidator parameterValidator;
  private final OrchestratorClient orchestratorClient;
  private final RestClient.Builder restClientBuilder;
  private final ObjectMapper objectMapper;

  public SlackTokenProvider(
      SlackTokenProperties properties,
      ParameterValidator parameterValidator,
      OrchestratorClient orchestratorClient,
      RestClient.Builder restClientBuilder,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.parameterValidator = parameterValidator;
    this.orchestratorClient = orchestratorClient;
    this.restClientBuilder = restClientBuilder;
    this.objectMapper = objectMapper;
  }

  @Override
  public String providerId() {
    return "slack-oauth";
  }

  @Override
  public List<OutputParameter> outputParameters() {
    return OUTPUTS;
  }

  @Override
  public CredentialBackend connect(TaskContext context) {
    var params = parameterValidator.validate("slack", properties);
    var exchangeTokens = exchangeTokens(params.exchangeTokensSecretId());
    var previousRefreshToken = previousRefreshToken(context);
    return new SlackTokenBackend(
        restClientBuilder.clone().baseUrl(params.apiUrl()).build(),
        exchangeTokens,
        previousRefreshToken);
  }

  private SlackExchangeTokens exchangeTokens(String secretId) {
    var secret = orchestratorClient.fetchSecret(secretId, Set.of(SecretType.ARBITRARY));
    SlackExchangeTokens tokens;
    try {
      tokens =
          objectMapper.readValue(
              secret.payload() == null ? "" : secret.payload(), SlackExchangeTokens.class);
    } catch (JsonProcessingException e) {
      throw new SecretFetchException(
          secretId, "exchange tokens secret '" + secretId + "' is not valid JSON", e);
    }
    if (isBlank(tokens.clientId())
        || isBlank(tokens.clientSecret())
        || isBlank(tokens.refreshToken())) {
      throw new SecretFetchException(
          secretId,
          "exchange tokens secret '"
              + secretId
              + "' must contain client_id, client_secret and refresh_token");
    }
    return tokens;
  }

  // The secret being rotated keeps the refresh token issued by the previous rotation.
  private String previousRefreshToken(TaskContext context) {
    try {
      var current =
          orchestratorClient.fetchSecret(context.secretId(), Set.of(SecretType.CUSTOM_CREDENTIALS));
      if (current.versionsTotal() <= 0) {
        return null;
      }
      return current.credentials().get("slack_refresh_token") instanceof String token
          ? token
          : null;
    } catch (SecretFetchException e) {
      log.warn(
          "Cannot read the previous version of secret {}: {}", context.secretId(), e.getMessage());
      return null;
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
