package io.b2mash.credentialjobs.backend.iam;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.credentialjobs.auth.IamTokenClient;
import io.b2mash.credentialjobs.backend.CredentialBackend;
import io.b2mash.credentialjobs.backend.CredentialProvider;
import io.b2mash.credentialjobs.backend.OutputParameter;
import io.b2mash.credentialjobs.backend.ParameterValidator;
import io.b2mash.credentialjobs.backend.ProviderAdapter;
import io.b2mash.credentialjobs.exception.SecretFetchException;
import io.b2mash.credentialjobs.orchestrator.OrchestratorClient;
import io.b2mash.credentialjobs.orchestrator.SecretType;
import io.b2mash.credentialjobs.orchestrator.SecretValue;
import io.b2mash.credentialjobs.task.TaskContext;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * IAM user API key provider. The API key used to call IAM comes from an arbitrary secret, or from
 * the {@code apikey} field of a custom credentials secret.
 */
@Component
@ProviderAdapter(slug = "iam-apikey")
public class IamApiKeyProvider implements CredentialProvider {

  private static final Logger log = LoggerFactory.getLogger(IamApiKeyProvider.class);

  static final List<OutputParameter> OUTPUTS =
      List.of(
          OutputParameter.required("apikey"),
          OutputParameter.optional("id"),
          OutputParameter.optional("crn"),
          OutputParameter.optional("iam_id"),
          OutputParameter.optional("account_id"));

  private final IamApiKeyProperties properties;
  private final ParameterValidator parameterValidator;
  private final OrchestratorClient orchestratorClient;
  private final IamTokenClient iamTokenClient;
  private final RestClient.Builder restClientBuilder;
  private final ObjectMapper objectMapper;

  public IamApiKeyProvider(
      IamApiKeyProperties properties,
      ParameterValidator parameterValidator,
      OrchestratorClient orchestratorClient,
      IamTokenClient iamTokenClient,
      RestClient.Builder restClientBuilder,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.parameterValidator = parameterValidator;
    this.orchestratorClient = orchestratorClient;
    this.iamTokenClient = iamTokenClient;
    this.restClientBuilder = restClientBuilder;
    this.objectMapper = objectMapper;
  }

  @Override
  public String providerId() {
    return "iam-apikey";
  }

  @Override
  public List<OutputParameter> outputParameters() {
    return OUTPUTS;
  }

  @Override
  public CredentialBackend connect(TaskContext context) {
    var params = parameterValidator.validate("iam", properties);
    log.info("Obtaining the IAM API key from secret {}", params.apikeySecretId());
    var secret =
        orchestratorClient.fetchSecret(
            params.apikeySecretId(), Set.of(SecretType.ARBITRARY, SecretType.CUSTOM_CREDENTIALS));
    var loginApiKey = loginApiKey(secret);

    var request =
        new IamApiKeyBackend.CreateApiKeyRequest(
            apiKeyName(context),
            apiKeyDescription(context),
            params.iamId(),
            params.accountId(),
            params.supportSessions(),
            blankToNull(params.actionWhenLeaked()));
    return new IamApiKeyBackend(
        restClientBuilder.clone().baseUrl(params.url()).build(),
        () -> iamTokenClient.bearerToken(params.url(), loginApiKey),
        objectMapper,
        request);
  }

  static String loginApiKey(SecretValue secret) {
    if (secret.type() == SecretType.ARBITRARY) {
      if (secret.payload() == null || secret.payload().isBlank()) {
        throw new SecretFetchException(secret.id(), "secret '" + secret.id() + "' is empty");
      }
      return secret.payload();
    }
    var apikey = secret.credentials().get("apikey");
    if (apikey == null) {
      throw new SecretFetchException(
          secret.id(), "secret '" + secret.id() + "' is missing 'apikey' field");
    }
    return String.valueOf(apikey);
  }

  // <secret name>-<last 6 characters of the task id>; the suffix keeps names unique per task.
  static String apiKeyName(TaskContext context) {
    var taskId = context.secretTaskId();
    var suffix = taskId.length() > 6 ? taskId.substring(taskId.length() - 6) : taskId;
    return context.secretName() + "-" + suffix;
  }

  static String apiKeyDescription(TaskContext context) {
    return "Created by Secrets Manager IAM user API Key provider for secret %s (%s) by %s"
        .formatted(context.secretName(), context.secretId(), context.secretTaskId());
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
