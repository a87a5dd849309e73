package io.b2mash.credentialjobs.task;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Values the orchestrator injects into every job run. Without the required ones nothing can be
 * reported back, so a missing value fails startup instead of producing a task report.
 *
 * @param instanceUrl base URL of the Secrets Manager instance
 * @param accessApikey API key the job uses to authenticate against the instance
 * @param secretId id of the secret the task belongs to
 * @param secretTaskId id of the task being processed
 * @param secretGroupId id of the secret's group
 * @param secretName name of the secret
 * @param action raw action selector, e.g. {@code create_credentials}
 * @param credentialsId id of the credential to delete; empty on create
 * @param secretVersionId id of the secret version the task was created for
 * @param trigger what triggered the task (create, rotate, manual rotate, delete)
 */
@Validated
@ConfigurationProperties(prefix = "sm")
public record TaskProperties(
    @NotBlank String instanceUrl,
    @NotBlank String accessApikey,
    @NotBlank String secretId,
    @NotBlank String secretTaskId,
    @NotBlank String secretGroupId,
    @NotBlank String secretName,
    @NotBlank String action,
    String credentialsId,
    String secretVersionId,
    String trigger) {}
