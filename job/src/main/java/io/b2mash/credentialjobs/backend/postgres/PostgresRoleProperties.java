package io.b2mash.credentialjobs.backend.postgres;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Parameters of the Postgres role provider.
 *
 * @param loginSecretId service credentials secret of the Databases for PostgreSQL deployment
 * @param schemaName schema the created role gets read-only access to
 * @param passwordLength length of generated role passwords
 */
@ConfigurationProperties(prefix = "postgres")
public record PostgresRoleProperties(
    @NotBlank String loginSecretId, String schemaName, @Min(12) Integer passwordLength) {

  public static final String DEFAULT_SCHEMA = "public";
  public static final int DEFAULT_PASSWORD_LENGTH = 64;

  public PostgresRoleProperties {
    if (schemaName == null || schemaName.isBlank()) {
      schemaName = DEFAULT_SCHEMA;
    }
    if (passwordLength == null) {
      passwordLength = DEFAULT_PASSWORD_LENGTH;
    }
  }
}
