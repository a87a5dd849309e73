package io.b2mash.credentialjobs.backend.jfrog;

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
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * JFrog scoped access token provider. JFrog is called with the token held by the login secret:
 * the payload of an arbitrary secret, or the password of a username_password secret.
 */
@Component
@ProviderAdapter(slug = "jfrog-access-token")
public class JFrogAccessTokenProvider implements CredentialProvider {

  static final List<OutputParameter> OUTPUTS =
      List.of(
          OutputParameter.required("access_token"), OutputParameter.optional("reference_token"));

  private final JFrogAccessTokenProperties properties;
  private final ParameterValidator parameterValidator;
  private final OrchestratorClient orchestratorClient;
  private final RestClient.Builder restClientBuilder;
  private final ObjectMapper objectMapper;

  public JFrogAccessTokenProvider(
      JFrogAccessTokenProperties properties,
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
    return "jfrog-access-token";
  }

  @Override
  public List<OutputParameter> outputParameters() {
    return OUTPUTS;
  }

  @Override
  public CredentialBackend connect(TaskContext context) {
    var params = parameterValidator.validate("jfrog", properties);
    var secret =
        orchestratorClient.fetchSecret(
            params.loginSecretId(), Set.of(SecretType.ARBITRARY, SecretType.USERNAME_PASSWORD));
    if (secret.payload() == null || secret.payload().isBlank()) {
      var field = secret.type() == SecretType.USERNAME_PASSWORD ? "password" : "payload";
      throw new SecretFetchException(
          secret.id(), "login secret '" + secret.id() + "' has an empty " + field);
    }
    var loginToken = secret.payload();

    var request =
        new JFrogAccessTokenBackend.CreateTokenRequest(
            blankToNull(params.username()),
            params.scope(),
            params.expiresInSeconds(),
            params.refreshable(),
            blankToNull(params.description()),
            params.audience(),
            params.includeReferenceToken(),
            blankToNull(params.grantType()));
    var restClient =
        restClientBuilder
            .clone()
            .baseUrl(params.baseUrl())
            .defaultHeaders(h -> h.setBearerAuth(loginToken))
            .build();
    return new JFrogAccessTokenBackend(restClient, objectMapper, request);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
