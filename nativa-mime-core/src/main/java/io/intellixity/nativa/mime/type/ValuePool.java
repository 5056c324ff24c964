package io.intellixity.nativa.mime.type;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Interning table for the strings repeated across descriptors (media types, encodings, extensions).\n
 *
 * A pool is owned by a registry index and handed to every descriptor built for it.
 */
public final class ValuePool {
  private static final ValuePool DISABLED = new ValuePool(null);

  private final ConcurrentHashMap<String, String> values;

  public ValuePool() {
    this(new ConcurrentHashMap<>());
  }

  private ValuePool(ConcurrentHashMap<String, String> values) {
    this.values = values;
  }

  /** Pass-through pool: {@link #intern(String)} returns its argument. */
  public static ValuePool disabled() { return DISABLED; }

  public String intern(String value) {
    if (value == null || values == null) return value;
    String prev = values.putIfAbsent(value, value);
    return prev == null ? value : prev;
  }

  public int size() { return values == null ? 0 : values.size(); }
}
