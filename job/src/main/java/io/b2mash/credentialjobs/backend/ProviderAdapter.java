package io.b2mash.credentialjobs.backend;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a credential provider. The CredentialProviderRegistry discovers beans
 * annotated with this at startup and builds the slug -> provider mapping.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface ProviderAdapter {
  /** Unique slug the job is configured with (e.g., "postgres-role"). */
  String slug();
}
