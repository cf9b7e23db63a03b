package com.wiligsi.turnstile.core.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The lock store backends that ship with turnstile. Other backends are registered by name with a
 * {@link LockStoreFactory}.
 *
 * @author Steven Miller
 */
public enum LockStoreKind {
  IN_MEMORY("in_memory", false),
  REDIS("redis", true);

  private final String typeName;
  private final boolean shared;

  LockStoreKind(String typeName, boolean shared) {
    this.typeName = typeName;
    this.shared = shared;
  }

  /**
   * The name used for this backend in endpoint files.
   *
   * @return the type name
   */
  public String getTypeName() {
    return typeName;
  }

  /**
   * Whether this backend can be used by more than one worker process.
   *
   * @return true for networked backends
   */
  public boolean isShared() {
    return shared;
  }

  public static Optional<LockStoreKind> fromTypeName(String typeName) {
    if (typeName == null) {
      return Optional.empty();
    }
    final String normalized = typeName.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(kind -> kind.typeName.equals(normalized))
        .findFirst();
  }
}
