package io.b2mash.credentialjobs.backend.postgres;

import io.b2mash.credentialjobs.backend.Credential;
import io.b2mash.credentialjobs.backend.CredentialBackend;
import io.b2mash.credentialjobs.exception.CredentialBackendException;
import java.util.LinkedHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Creates read-only login roles for one schema. Each create and each revoke runs in a single
 * transaction, so a failed grant leaves no role behind. The credential id is the role's OID, which
 * stays stable if the role is renamed.
 */
class PostgresRoleBackend implements CredentialBackend {

  private static final Logger log = LoggerFactory.getLogger(PostgresRoleBackend.class);

  private static final long MAX_OID = 0xFFFF_FFFFL;

  private final JdbcTemplate jdbc;
  private final TransactionTemplate txTemplate;
  private final String schemaName;
  private final PostgresConnectionInfo connectionInfo;
  private final Supplier<String> roleNames;
  private final Supplier<String> passwords;
  private final Runnable onClose;

  PostgresRoleBackend(
      JdbcTemplate jdbc,
      PlatformTransactionManager transactionManager,
      String schemaName,
      PostgresConnectionInfo connectionInfo,
      Supplier<String> roleNames,
      Supplier<String> passwords,
      Runnable onClose) {
    this.jdbc = jdbc;
    this.txTemplate = new TransactionTemplate(transactionManager);
    this.schemaName = schemaName;
    this.connectionInfo = connectionInfo;
    this.roleNames = roleNames;
    this.passwords = passwords;
    this.onClose = onClose;
  }

  @Override
  public Credential create() {
    var roleName = roleNames.get();
    var password = passwords.get();

    Long roleOid =
        txTemplate.execute(
            status -> {
              step(
                  "cannot create role with login password",
                  () ->
                      jdbc.execute(
                          "CREATE ROLE "
                              + quoteIdentifier(roleName)
                              + " WITH LOGIN PASSWORD "
                              + quoteLiteral(password)));
              var oid =
                  query(
                      "cannot retrieve role oid",
                      () ->
                          jdbc.queryForObject(
                              "SELECT oid FROM pg_roles WHERE rolname = ?", Long.class, roleName));
              step(
                  "cannot grant role " + oid + " usage on schema '" + schemaName + "'",
                  () ->
                      jdbc.execute(
                          "GRANT USAGE ON SCHEMA "
                              + quoteIdentifier(schemaName)
                              + " TO "
                              + quoteIdentifier(roleName)));
              step(
                  "cannot grant role "
                      + oid
                      + " select on all tables in schema '"
                      + schemaName
                      + "'",
                  () ->
                      jdbc.execute(
                          "GRANT SELECT ON ALL TABLES IN SCHEMA "
                              + quoteIdentifier(schemaName)
                              + " TO "
                              + quoteIdentifier(roleName)));
              return oid;
            });
    log.info("Created role oid {} for schema '{}'", roleOid, schemaName);

    var payload = new LinkedHashMap<String, Object>();
    payload.put("certificate_base64", connectionInfo.certificateBase64());
    payload.put("username", roleName);
    payload.put("password", password);
    payload.put("composed", connectionInfo.composedFor(roleName, password));
    return new Credential(String.valueOf(roleOid), payload);
  }

  @Override
  public void revoke(String credentialId) {
    var oid = parseOid(credentialId);
    var dropped =
        txTemplate.execute(
            status -> {
              var names =
                  query(
                      "error checking role with oid '" + oid + "' existence",
                      () ->
                          jdbc.queryForList(
                              "SELECT rolname FROM pg_roles WHERE oid = CAST(? AS oid)",
                              String.class,
                              oid));
              if (names.isEmpty()) {
                return false;
              }
              var role = quoteIdentifier(names.get(0));
              var schema = quoteIdentifier(schemaName);
              step(
                  "cannot revoke privileges for role with oid " + oid,
                  () -> {
                    jdbc.execute("REVOKE ALL PRIVILEGES ON SCHEMA " + schema + " FROM " + role);
                    jdbc.execute(
                        "REVOKE ALL PRIVILEGES ON ALL TABLES IN SCHEMA "
                            + schema
                            + " FROM "
                            + role);
                  });
              step(
                  "cannot drop role with oid " + oid,
                  () -> jdbc.execute("DROP ROLE IF EXISTS " + role));
              return true;
            });
    if (Boolean.TRUE.equals(dropped)) {
      log.info("Role with oid '{}' dropped for schema '{}'", oid, schemaName);
    } else {
      log.info("No operation required, role with oid '{}' not found", oid);
    }
  }

  @Override
  public void close() {
    onClose.run();
  }

  static long parseOid(String credentialId) {
    try {
      var oid = Long.parseLong(credentialId);
      if (oid < 0 || oid > MAX_OID) {
        throw new NumberFormatException("out of range");
      }
      return oid;
    } catch (NumberFormatException e) {
      throw new CredentialBackendException(
          "revoke",
          "cannot convert credentials id '" + credentialId + "' to a role oid: " + e.getMessage(),
          e);
    }
  }

  static String quoteIdentifier(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }

  static String quoteLiteral(String literal) {
    return "'" + literal.replace("'", "''") + "'";
  }

  private static void step(String failureMessage, Runnable statement) {
    query(
        failureMessage,
        () -> {
          statement.run();
          return null;
        });
  }

  private static <T> T query(String failureMessage, Supplier<T> query) {
    try {
      return query.get();
    } catch (DataAccessException e) {
      throw new CredentialBackendException(
          "postgres", failureMessage + ". error: " + e.getMostSpecificCause().getMessage(), e);
    }
  }
}
