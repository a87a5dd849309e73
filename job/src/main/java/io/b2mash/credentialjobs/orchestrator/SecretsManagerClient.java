package io.b2mash.credentialjobs.orchestrator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.credentialjobs.auth.IamEndpoint;
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
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * {@link OrchestratorClient} backed by the Secrets Manager v2 REST API. Failures of any kind while
 * talking to the service, token exchange included, surface as {@link SecretFetchException} or
 * {@link TaskReportException}.
 */
@Component
public class SecretsManagerClient implements OrchestratorClient {

  private static final Logger log = LoggerFactory.getLogger(SecretsManagerClient.class);

  static final String STATUS_CREATED = "credentials_created";
  static final String STATUS_DELETED = "credentials_deleted";
  static final String STATUS_FAILED = "failed";

  private final RestClient restClient;

  public SecretsManagerClient(
      RestClient.Builder restClientBuilder,
      IamTokenClient iamTokenClient,
      TaskProperties taskProperties) {
    var iamUrl = IamEndpoint.forInstance(taskProperties.instanceUrl());
    var apiKey = taskProperties.accessApikey();
    this.restClient =
        restClientBuilder
            .baseUrl(stripTrailingSlash(taskProperties.instanceUrl()))
            .requestInterceptor(
                (request, body, execution) -> {
                  request.getHeaders().setBearerAuth(iamTokenClient.bearerToken(iamUrl, apiKey));
                  return execution.execute(request, body);
                })
            .build();
  }

  @Override
  public SecretValue fetchSecret(String secretId, Set<SecretType> expectedTypes) {
    SecretResource resource;
    try {
      var response =
          restClient
              .get()
              .uri("/api/v2/secrets/{id}", secretId)
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .toEntity(SecretResource.class);
      if (response.getStatusCode().value() != HttpStatus.OK.value()
          || response.getBody() == null) {
        throw new SecretFetchException(
            secretId,
            "reading secret "
                + secretId
                + " returned status "
                + response.getStatusCode().value()
                + " instead of 200");
      }
      resource = response.getBody();
    } catch (SecretFetchException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SecretFetchException(
          secretId, "failed to read secret " + secretId + ": " + e.getMessage(), e);
    }

    var type = SecretType.fromValue(resource.secretType());
    if (!expectedTypes.contains(type)) {
      throw new SecretFetchException(
          secretId,
          "secret "
              + secretId
              + " has type '"
              + resource.secretType()
              + "', expected one of "
              + expectedTypes.stream().map(SecretType::getValue).sorted().toList());
    }
    return new SecretValue(
        resource.id(),
        type,
        type == SecretType.USERNAME_PASSWORD
            ? resource.password()
            : resource.payload() instanceof String s ? s : null,
        type == SecretType.CUSTOM_CREDENTIALS
            ? resource.credentialsContent()
            : resource.credentials(),
        resource.versionsTotal() == null ? 0 : resource.versionsTotal());
  }

  @Override
  public TaskAcknowledgement reportCreated(
      TaskContext context, Credential credential, List<OutputParameter> outputParameters) {
    var violations = CredentialPayloadValidator.violations(credential.payload(), outputParameters);
    if (!violations.isEmpty()) {
      throw new TaskReportException(
          "credentials payload was rejected: " + String.join("; ", violations));
    }
    log.debug(
        "Reporting credentials {} with fields [{}]",
        credential.id(),
        credential.payload().keySet().stream().sorted().collect(Collectors.joining(", ")));
    var update =
        new TaskUpdate(
            STATUS_CREATED, new CredentialsBody(credential.id(), credential.payload()), null);
    return updateTask(context, update);
  }

  @Override
  public TaskAcknowledgement reportDeleted(TaskContext context) {
    return updateTask(context, new TaskUpdate(STATUS_DELETED, null, null));
  }

  @Override
  public TaskAcknowledgement reportFailed(
      TaskContext context, TaskErrorCode code, String description) {
    var error = new TaskError(code.getCode(), description);
    return updateTask(context, new TaskUpdate(STATUS_FAILED, null, List.of(error)));
  }

  private TaskAcknowledgement updateTask(TaskContext context, TaskUpdate update) {
    try {
      var task =
          restClient
              .put()
              .uri(
                  "/api/v2/secrets/{secretId}/tasks/{taskId}",
                  context.secretId(),
                  context.secretTaskId())
              .contentType(MediaType.APPLICATION_JSON)
              .accept(MediaType.APPLICATION_JSON)
              .body(update)
              .retrieve()
              .body(TaskResource.class);
      var ack =
          task == null
              ? new TaskAcknowledgement(context.secretTaskId(), update.status(), null)
              : new TaskAcknowledgement(task.id(), task.status(), task.updatedBy());
      log.info("Task updated to status '{}' by {}", update.status(), ack.updatedBy());
      return ack;
    } catch (RuntimeException e) {
      throw new TaskReportException(
          "failed to update task "
              + context.secretTaskId()
              + " to status '"
              + update.status()
              + "': "
              + e.getMessage(),
          e);
    }
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record SecretResource(
      String id,
      @JsonProperty("secret_type") String secretType,
      Object payload,
      String password,
      Map<String, Object> credentials,
      @JsonProperty("credentials_content") Map<String, Object> credentialsContent,
      @JsonProperty("versions_total") Integer versionsTotal) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record TaskUpdate(String status, CredentialsBody credentials, List<TaskError> errors) {}

  record CredentialsBody(String id, Map<String, Object> payload) {}

  record TaskError(String code, String description) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TaskResource(String id, String status, @JsonProperty("updated_by") String updatedBy) {}
}
