package io.b2mash.credentialjobs.retry;

import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Decides whether a backend failure is worth retrying: transport errors, HTTP 429 or above and
 * database connections that could not be opened.
 */
public final class TransientFailures {

  private static final int TOO_MANY_REQUESTS = 429;

  private TransientFailures() {}

  public static boolean isTransient(Throwable failure) {
    for (var t = failure; t != null; t = t.getCause() == t ? null : t.getCause()) {
      if (t instanceof ResourceAccessException) {
        return true;
      }
      if (t instanceof RestClientResponseException response) {
        return response.getStatusCode().value() >= TOO_MANY_REQUESTS;
      }
      if (t instanceof TransientDataAccessException
          || t instanceof DataAccessResourceFailureException
          || t instanceof CannotCreateTransactionException
          || t instanceof SQLTransientException
          || t instanceof SQLRecoverableException) {
        return true;
      }
    }
    return false;
  }
}
