package io.b2mash.credentialjobs.backend.postgres;

import java.security.SecureRandom;
import java.util.UUID;

final class RolePasswordGenerator {

  static final String PASSWORD_CHARS =
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789!$-_*";
  static final int MIN_LENGTH = 12;
  static final String ROLE_PREFIX = "secrets_manager_";

  private static final SecureRandom RANDOM = new SecureRandom();

  private RolePasswordGenerator() {}

  static String password(int length) {
    if (length < MIN_LENGTH) {
      throw new IllegalArgumentException(
          "password length must be at least " + MIN_LENGTH + " characters");
    }
    var password = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      password.append(PASSWORD_CHARS.charAt(RANDOM.nextInt(PASSWORD_CHARS.length())));
    }
    return password.toString();
  }

  static String roleName() {
    return ROLE_PREFIX + UUID.randomUUID().toString().replace('-', '_');
  }
}
