package io.b2mash.credentialjobs.backend;

import io.b2mash.credentialjobs.exception.JobConfigurationException;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.stereotype.Component;

@Component
public class CredentialProviderRegistry {

  // Built at startup: slug -> provider bean
  private final Map<String, CredentialProvider> providers = new TreeMap<>();

  public CredentialProviderRegistry(ApplicationContext applicationContext) {
    // Fail fast on duplicate slugs and on providers that could never produce a valid payload.
    applicationContext
        .getBeansWithAnnotation(ProviderAdapter.class)
        .forEach(
            (name, bean) -> {
              var annotation =
                  AnnotationUtils.findAnnotation(bean.getClass(), ProviderAdapter.class);
              if (!(bean instanceof CredentialProvider provider)) {
                throw new IllegalStateException(
                    "@ProviderAdapter bean " + name + " does not implement CredentialProvider");
              }
              register(annotation.slug(), provider);
            });
  }

  void register(String slug, CredentialProvider provider) {
    if (!slug.equals(provider.providerId())) {
      throw new IllegalStateException(
          "@ProviderAdapter slug="
              + slug
              + " does not match providerId="
              + provider.providerId()
              + " of "
              + provider.getClass().getName());
    }
    if (provider.outputParameters().stream().noneMatch(OutputParameter::required)) {
      throw new IllegalStateException(
          "Provider " + slug + " must declare at least one required output parameter");
    }
    var existing = providers.putIfAbsent(slug, provider);
    if (existing != null) {
      throw new IllegalStateException(
          "Duplicate @ProviderAdapter: slug="
              + slug
              + " registered by both "
              + existing.getClass().getName()
              + " and "
              + provider.getClass().getName());
    }
  }

  /**
   * Returns the provider registered under {@code slug}.
   *
   * @throws JobConfigurationException if no provider has that slug
   */
  public CredentialProvider resolve(String slug) {
    if (slug == null || slug.isBlank()) {
      throw new JobConfigurationException(
          "no credential provider configured, expected one of " + providers.keySet());
    }
    var provider = providers.get(slug);
    if (provider == null) {
      throw new JobConfigurationException(
          "unknown credential provider '" + slug + "', expected one of " + providers.keySet());
    }
    return provider;
  }

  public Set<String> availableSlugs() {
    return Set.copyOf(providers.keySet());
  }
}
