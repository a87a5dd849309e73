package io.b2mash.credentialjobs.orchestrator;

import io.b2mash.credentialjobs.backend.OutputParameter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Checks a credential payload against the output parameters its provider declares: every required
 * parameter present and non-blank, nothing undeclared, only flat string/number/boolean values and
 * no string longer than {@value #MAX_VALUE_LENGTH} characters.
 */
final class CredentialPayloadValidator {

  static final int MAX_VALUE_LENGTH = 100_000;

  private CredentialPayloadValidator() {}

  static List<String> violations(Map<String, Object> payload, List<OutputParameter> parameters) {
    var violations = new ArrayList<String>();
    var declared =
        parameters.stream().collect(Collectors.toMap(OutputParameter::name, p -> p));

    for (var parameter : parameters) {
      var value = payload.get(parameter.name());
      if (parameter.required() && (value == null || value instanceof String s && s.isBlank())) {
        violations.add("required field '" + parameter.name() + "' is missing");
      }
    }
    payload.forEach(
        (name, value) -> {
          if (!declared.containsKey(name)) {
            violations.add("field '" + name + "' is not a declared output");
          } else if (value instanceof String s) {
            if (s.length() > MAX_VALUE_LENGTH) {
              violations.add(
                  "field '" + name + "' exceeds " + MAX_VALUE_LENGTH + " characters");
            }
          } else if (value != null && !(value instanceof Number) && !(value instanceof Boolean)) {
            violations.add("field '" + name + "' must be a string, number or boolean");
          }
        });
    return violations;
  }
}
