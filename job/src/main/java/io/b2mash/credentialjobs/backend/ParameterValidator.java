package io.b2mash.credentialjobs.backend;

import io.b2mash.credentialjobs.exception.JobConfigurationException;
import jakarta.validation.Validator;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Validates provider parameters when a provider connects. Parameters of providers that are not
 * selected stay unvalidated, so they cannot fail startup.
 */
@Component
public class ParameterValidator {

  private final Validator validator;

  public ParameterValidator(Validator validator) {
    this.validator = validator;
  }

  /** @throws JobConfigurationException listing every violated constraint */
  public <T> T validate(String prefix, T parameters) {
    var violations = validator.validate(parameters);
    if (!violations.isEmpty()) {
      var details =
          violations.stream()
              .map(v -> prefix + "." + v.getPropertyPath() + " " + v.getMessage())
              .sorted()
              .collect(Collectors.joining(", "));
      throw new JobConfigurationException("invalid provider parameters: " + details);
    }
    return parameters;
  }
}
