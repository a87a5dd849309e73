package io.b2mash.credentialjobs.backend;

/** A field a provider puts into the credential payload it reports. */
public record OutputParameter(String name, boolean required) {

  public static OutputParameter required(String name) {
    return new OutputParameter(name, true);
  }

  public static OutputParameter optional(String name) {
    return new OutputParameter(name, false);
  }
}
