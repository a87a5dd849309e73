package io.b2mash.credentialjobs.auth;

/** Picks the IAM endpoint that belongs to a Secrets Manager instance. */
public final class IamEndpoint {

  static final String PRODUCTION_URL = "https://iam.cloud.ibm.com";
  static final String STAGING_URL = "https://iam.test.cloud.ibm.com";
  private static final String STAGING_INSTANCE_DOMAIN = "secrets-manager.test.appdomain.cloud";

  private IamEndpoint() {}

  public static String forInstance(String instanceUrl) {
    if (instanceUrl != null && instanceUrl.contains(STAGING_INSTANCE_DOMAIN)) {
      return STAGING_URL;
    }
    return PRODUCTION_URL;
  }
}
