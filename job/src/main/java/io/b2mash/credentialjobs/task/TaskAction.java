package io.b2mash.credentialjobs.task;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

public enum TaskAction {
  CREATE("create_credentials", "create"),
  DELETE("delete_credentials", "delete");

  private final String selector;
  private final Set<String> aliases;

  TaskAction(String selector, String... aliases) {
    this.selector = selector;
    this.aliases = Set.of(aliases);
  }

  public String getSelector() {
    return selector;
  }

  /** Maps the selector the orchestrator sends to an action; empty when it is not recognised. */
  public static Optional<TaskAction> fromSelector(String value) {
    if (value == null) {
      return Optional.empty();
    }
    var normalized = value.trim().toLowerCase();
    return Arrays.stream(values())
        .filter(a -> a.selector.equals(normalized) || a.aliases.contains(normalized))
        .findFirst();
  }
}
