package io.b2mash.credentialjobs.backend.certificate;

import io.b2mash.credentialjobs.backend.Credential;
import io.b2mash.credentialjobs.backend.CredentialBackend;
import io.b2mash.credentialjobs.exception.CredentialBackendException;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.security.spec.ECGenParameterSpec;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Date;
import java.util.LinkedHashMap;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.operator.OperatorException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates a key pair and a self-signed server certificate in memory. Nothing is stored outside
 * the reported payload, so revoking is a no-op. Intended for development and testing.
 */
class SelfSignedCertificateBackend implements CredentialBackend {

  private static final Logger log = LoggerFactory.getLogger(SelfSignedCertificateBackend.class);

  private static final BouncyCastleProvider BC_PROVIDER = new BouncyCastleProvider();
  private static final SecureRandom RANDOM = new SecureRandom();

  private final CertificateProperties properties;
  private final Clock clock;

  SelfSignedCertificateBackend(CertificateProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public Credential create() {
    try {
      var keyPair = generateKeyPair();
      var serialNumber = new BigInteger(128, RANDOM);
      var certificate = buildCertificate(keyPair, serialNumber);
      log.info("Certificate with serial number '{}' was generated", serialNumber);

      var payload = new LinkedHashMap<String, Object>();
      payload.put("private_key_base64", base64Pem(keyPair.getPrivate()));
      payload.put("certificate_base64", base64Pem(certificate));
      return new Credential(serialNumber.toString(), payload);
    } catch (GeneralSecurityException | OperatorException | IOException e) {
      throw new CredentialBackendException(
          "create", "cannot generate certificate: " + e.getMessage(), e);
    }
  }

  @Override
  public void revoke(String credentialId) {
    log.info("Certificate with serial number '{}' is not stored, nothing to revoke", credentialId);
  }

  private KeyPair generateKeyPair() throws GeneralSecurityException {
    if (CertificateProperties.KEY_ALGO_ECDSA.equals(properties.keyAlgo())) {
      var generator = KeyPairGenerator.getInstance("EC");
      generator.initialize(new ECGenParameterSpec("secp256r1"), RANDOM);
      return generator.generateKeyPair();
    }
    var generator = KeyPairGenerator.getInstance("RSA");
    generator.initialize(2048, RANDOM);
    return generator.generateKeyPair();
  }

  private X509Certificate buildCertificate(KeyPair keyPair, BigInteger serialNumber)
      throws GeneralSecurityException, OperatorException, IOException {
    var subject = subject();
    var notBefore = clock.instant();
    var notAfter = notBefore.plus(Duration.ofDays(properties.expirationDays()));

    var builder =
        new JcaX509v3CertificateBuilder(
            subject,
            serialNumber,
            Date.from(notBefore),
            Date.from(notAfter),
            subject,
            keyPair.getPublic());
    builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
    builder.addExtension(
        Extension.keyUsage,
        true,
        new KeyUsage(KeyUsage.keyEncipherment | KeyUsage.digitalSignature));
    builder.addExtension(
        Extension.extendedKeyUsage, false, new ExtendedKeyUsage(KeyPurposeId.id_kp_serverAuth));
    var dnsNames = properties.dnsNames();
    if (!dnsNames.isEmpty()) {
      var names =
          dnsNames.stream()
              .map(name -> new GeneralName(GeneralName.dNSName, name))
              .toArray(GeneralName[]::new);
      builder.addExtension(Extension.subjectAlternativeName, false, new GeneralNames(names));
    }

    var signer =
        new JcaContentSignerBuilder(signatureAlgorithm())
            .setProvider(BC_PROVIDER)
            .build(keyPair.getPrivate());
    return new JcaX509CertificateConverter()
        .setProvider(BC_PROVIDER)
        .getCertificate(builder.build(signer));
  }

  private X500Name subject() {
    var name = new X500NameBuilder(BCStyle.INSTANCE).addRDN(BCStyle.CN, properties.commonName());
    if (properties.organization() != null && !properties.organization().isBlank()) {
      name.addRDN(BCStyle.O, properties.organization());
    }
    if (properties.country() != null && !properties.country().isBlank()) {
      name.addRDN(BCStyle.C, properties.country().toUpperCase());
    }
    return name.build();
  }

  String signatureAlgorithm() {
    var hash = properties.signAlgo();
    var key = CertificateProperties.KEY_ALGO_ECDSA.equals(properties.keyAlgo()) ? "ECDSA" : "RSA";
    return hash + "with" + key;
  }

  // RSA keys are written as "RSA PRIVATE KEY" (PKCS#1), EC keys as "EC PRIVATE KEY" (SEC 1).
  private static String base64Pem(Object object) throws IOException {
    var pem = new StringWriter();
    try (var writer = new JcaPEMWriter(pem)) {
      writer.writeObject(object);
    }
    return Base64.getEncoder().encodeToString(pem.toString().getBytes(StandardCharsets.UTF_8));
  }
}
