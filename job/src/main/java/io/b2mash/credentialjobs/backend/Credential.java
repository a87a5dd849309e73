package io.b2mash.credentialjobs.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A credential created by a backend.
 *
 * @param id backend-assigned id; enough to revoke the credential later
 * @param payload flat output values keyed by output parameter name
 */
public record Credential(String id, Map<String, Object> payload) {

  public Credential {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("credential id must not be blank");
    }
    payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  @Override
  public String toString() {
    return "Credential[id=" + id + ", fields=" + payload.keySet() + "]";
  }
}
