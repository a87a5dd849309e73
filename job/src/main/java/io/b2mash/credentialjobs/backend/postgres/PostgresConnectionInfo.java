package io.b2mash.credentialjobs.backend.postgres;

import io.b2mash.credentialjobs.exception.SecretFetchException;
import io.b2mash.credentialjobs.orchestrator.SecretValue;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Connection details read from a Databases for PostgreSQL service credentials secret.
 *
 * @param composed connection URL including the admin user, e.g. {@code
 *     postgres://admin:pw@host:31234/ibmclouddb?sslmode=verify-full}
 * @param certificateBase64 CA certificate of the deployment, base64 encoded PEM
 */
record PostgresConnectionInfo(URI composed, String certificateBase64) {

  static final String CERTIFICATE_PATH = "connection/postgres/certificate/certificate_base64";
  static final String COMPOSED_PATH = "connection/postgres/composed/0";

  static PostgresConnectionInfo from(SecretValue secret) {
    var certificate =
        secret
            .stringAtPath(CERTIFICATE_PATH)
            .orElseThrow(
                () ->
                    new SecretFetchException(
                        secret.id(),
                        "postgres certificate was not found in path: '" + CERTIFICATE_PATH + "'"));
    var composed =
        secret
            .stringAtPath(COMPOSED_PATH)
            .orElseThrow(
                () ->
                    new SecretFetchException(
                        secret.id(),
                        "postgres composed was not found in path: '" + COMPOSED_PATH + "'"));
    try {
      Base64.getDecoder().decode(certificate);
      var uri = new URI(composed);
      if (uri.getHost() == null || uri.getUserInfo() == null) {
        throw new SecretFetchException(
            secret.id(), "postgres composed url has no host or user: '" + uri.getHost() + "'");
      }
      return new PostgresConnectionInfo(uri, certificate);
    } catch (IllegalArgumentException e) {
      throw new SecretFetchException(
          secret.id(), "postgres certificate decoding error: " + e.getMessage(), e);
    } catch (URISyntaxException e) {
      throw new SecretFetchException(
          secret.id(), "cannot parse postgres composed url: " + e.getMessage(), e);
    }
  }

  String certificatePem() {
    return new String(Base64.getDecoder().decode(certificateBase64), StandardCharsets.UTF_8);
  }

  String jdbcUrl() {
    var port = composed.getPort() > 0 ? ":" + composed.getPort() : "";
    var query = composed.getRawQuery() == null ? "" : "?" + composed.getRawQuery();
    return "jdbc:postgresql://" + composed.getHost() + port + composed.getRawPath() + query;
  }

  String username() {
    var userInfo = composed.getUserInfo();
    var separator = userInfo.indexOf(':');
    return separator < 0 ? userInfo : userInfo.substring(0, separator);
  }

  String password() {
    var userInfo = composed.getUserInfo();
    var separator = userInfo.indexOf(':');
    return separator < 0 ? null : userInfo.substring(separator + 1);
  }

  /** The composed URL with the admin user replaced by {@code username:password}. */
  String composedFor(String username, String password) {
    try {
      return new URI(
              composed.getScheme(),
              username + ":" + password,
              composed.getHost(),
              composed.getPort(),
              composed.getPath(),
              composed.getQuery(),
              composed.getFragment())
          .toString();
    } catch (URISyntaxException e) {
      throw new IllegalStateException("cannot build composed url for role " + username, e);
    }
  }
}
