package io.b2mash.credentialjobs.backend.certificate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.util.Arrays;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Parameters of the self-signed certificate provider.
 *
 * @param commonName subject common name
 * @param organization subject organization
 * @param country two-letter subject country code
 * @param san comma-separated DNS subject alternative names
 * @param expirationDays validity period in days
 * @param keyAlgo {@code RSA} (2048 bit) or {@code ECDSA} (P-256)
 * @param signAlgo {@code SHA256} or {@code SHA512}
 */
@ConfigurationProperties(prefix = "certificate")
public record CertificateProperties(
    @NotBlank String commonName,
    String organization,
    @Pattern(regexp = "^$|[A-Za-z]{2}") String country,
    String san,
    @Positive Integer expirationDays,
    @Pattern(regexp = "RSA|ECDSA") String keyAlgo,
    @Pattern(regexp = "SHA256|SHA512") String signAlgo) {

  public static final int DEFAULT_EXPIRATION_DAYS = 90;
  public static final String KEY_ALGO_RSA = "RSA";
  public static final String KEY_ALGO_ECDSA = "ECDSA";
  public static final String SIGN_ALGO_SHA256 = "SHA256";

  public CertificateProperties {
    if (expirationDays == null || expirationDays == 0) {
      expirationDays = DEFAULT_EXPIRATION_DAYS;
    }
    if (keyAlgo == null || keyAlgo.isBlank()) {
      keyAlgo = KEY_ALGO_RSA;
    }
    if (signAlgo == null || signAlgo.isBlank()) {
      signAlgo = SIGN_ALGO_SHA256;
    }
  }

  public List<String> dnsNames() {
    if (san == null || san.isBlank()) {
      return List.of();
    }
    return Arrays.stream(san.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
  }
}
