package io.b2mash.credentialjobs.orchestrator;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A secret read from the orchestrator.
 *
 * @param id secret id
 * @param type declared secret type
 * @param payload payload of an arbitrary secret or password of a username_password secret,
 *     otherwise null
 * @param credentials credentials content of a custom or service credentials secret, otherwise empty
 * @param versionsTotal number of versions the secret has
 */
public record SecretValue(
    String id,
    SecretType type,
    String payload,
    Map<String, Object> credentials,
    int versionsTotal) {

  public SecretValue {
    credentials = credentials == null ? Map.of() : credentials;
  }

  /**
   * Looks up a value inside {@link #credentials()} by a {@code /}-separated path. Numeric segments
   * index into lists, e.g. {@code connection/postgres/composed/0}.
   */
  public Optional<Object> valueAtPath(String path) {
    Object current = credentials;
    for (var segment : path.split("/")) {
      if (current instanceof Map<?, ?> map) {
        current = map.get(segment);
      } else if (current instanceof List<?> list) {
        try {
          var index = Integer.parseInt(segment);
          current = index >= 0 && index < list.size() ? list.get(index) : null;
        } catch (NumberFormatException e) {
          return Optional.empty();
        }
      } else {
        return Optional.empty();
      }
      if (current == null) {
        return Optional.empty();
      }
    }
    return Optional.of(current);
  }

  /** Like {@link #valueAtPath(String)}, but only returns non-blank strings. */
  public Optional<String> stringAtPath(String path) {
    return valueAtPath(path)
        .filter(String.class::isInstance)
        .map(String.class::cast)
        .filter(s -> !s.isBlank());
  }
}
