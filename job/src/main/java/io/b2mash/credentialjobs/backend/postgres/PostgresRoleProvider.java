package io.b2mash.credentialjobs.backend.postgres;

import com.zaxxer.hikari.HikariDataSource;
import io.b2mash.credentialjobs.backend.CredentialBackend;
import io.b2mash.credentialjobs.backend.CredentialProvider;
import io.b2mash.credentialjobs.backend.OutputParameter;
import io.b2mash.credentialjobs.backend.ParameterValidator;
import io.b2mash.credentialjobs.backend.ProviderAdapter;
import io.b2mash.credentialjobs.orchestrator.OrchestratorClient;
import io.b2mash.credentialjobs.orchestrator.SecretType;
import io.b2mash.credentialjobs.task.TaskContext;
import java.util.List;
import java.util.Set;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;

/**
 * Databases for PostgreSQL role provider. Connects with the admin user from a service credentials
 * secret, over TLS verified against the deployment's own CA certificate.
 */
@Component
@ProviderAdapter(slug = "postgres-role")
public class PostgresRoleProvider implements CredentialProvider {

  static final List<OutputParameter> OUTPUTS =
      List.of(
          OutputParameter.required("username"),
          OutputParameter.required("password"),
          OutputParameter.optional("composed"),
          OutputParameter.optional("certificate_base64"));

  static final String SSL_FACTORY = "org.postgresql.ssl.SingleCertValidatingFactory";

  private final PostgresRoleProperties properties;
  private final ParameterValidator parameterValidator;
  private final OrchestratorClient orchestratorClient;

  public PostgresRoleProvider(
      PostgresRoleProperties properties,
      ParameterValidator parameterValidator,
      OrchestratorClient orchestratorClient) {
    this.properties = properties;
    this.parameterValidator = parameterValidator;
    this.orchestratorClient = orchestratorClient;
  }

  @Override
  public String providerId() {
    return "postgres-role";
  }

  @Override
  public List<OutputParameter> outputParameters() {
    return OUTPUTS;
  }

  @Override
  public CredentialBackend connect(TaskContext context) {
    var params = parameterValidator.validate("postgres", properties);
    var secret =
        orchestratorClient.fetchSecret(
            params.loginSecretId(), Set.of(SecretType.SERVICE_CREDENTIALS));
    var connectionInfo = PostgresConnectionInfo.from(secret);

    var dataSource = dataSource(connectionInfo);
    return new PostgresRoleBackend(
        new JdbcTemplate(dataSource),
        new DataSourceTransactionManager(dataSource),
        params.schemaName(),
        connectionInfo,
        RolePasswordGenerator::roleName,
        () -> RolePasswordGenerator.password(params.passwordLength()),
        dataSource::close);
  }

  // The pool starts on first use. A refused connection then fails the transaction begin with
  // CannotCreateTransactionException, which the retry policy treats as transient.
  static HikariDataSource dataSource(PostgresConnectionInfo connectionInfo) {
    var dataSource = new HikariDataSource();
    dataSource.setPoolName("postgres-role");
    dataSource.setJdbcUrl(connectionInfo.jdbcUrl());
    dataSource.setUsername(connectionInfo.username());
    dataSource.setPassword(connectionInfo.password());
    dataSource.setMaximumPoolSize(1);
    dataSource.setAutoCommit(true);
    dataSource.addDataSourceProperty("sslfactory", SSL_FACTORY);
    dataSource.addDataSourceProperty("sslfactoryarg", connectionInfo.certificatePem());
    return dataSource;
  }
}
