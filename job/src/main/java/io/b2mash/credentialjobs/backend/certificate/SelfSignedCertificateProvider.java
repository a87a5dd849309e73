package io.b2mash.credentialjobs.backend.certificate;

import io.b2mash.credentialjobs.backend.CredentialBackend;
import io.b2mash.credentialjobs.backend.CredentialProvider;
import io.b2mash.credentialjobs.backend.OutputParameter;
import io.b2mash.credentialjobs.backend.ParameterValidator;
import io.b2mash.credentialjobs.backend.ProviderAdapter;
import io.b2mash.credentialjobs.task.TaskContext;
import java.time.Clock;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
@ProviderAdapter(slug = "self-signed-certificate")
public class SelfSignedCertificateProvider implements CredentialProvider {

  static final List<OutputParameter> OUTPUTS =
      List.of(
          OutputParameter.required("certificate_base64"),
          OutputParameter.required("private_key_base64"));

  private final CertificateProperties properties;
  private final ParameterValidator parameterValidator;

  public SelfSignedCertificateProvider(
      CertificateProperties properties, ParameterValidator parameterValidator) {
    this.properties = properties;
    this.parameterValidator = parameterValidator;
  }

  @Override
  public String providerId() {
    return "self-signed-certificate";
  }

  @Override
  public List<OutputParameter> outputParameters() {
    return OUTPUTS;
  }

  @Override
  public CredentialBackend connect(TaskContext context) {
    return new SelfSignedCertificateBackend(
        parameterValidator.validate("certificate", properties), Clock.systemUTC());
  }
}
