package io.b2mash.credentialjobs.orchestrator;

public enum SecretType {
  ARBITRARY("arbitrary"),
  CUSTOM_CREDENTIALS("custom_credentials"),
  SERVICE_CREDENTIALS("service_credentials"),
  USERNAME_PASSWORD("username_password"),
  OTHER("other");

  private final String value;

  SecretType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public static SecretType fromValue(String value) {
    for (var type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }
    return OTHER;
  }
}
