package io.intellixity.scoped.carrier;

import java.util.Locale;

/** Storage strategy behind the process-wide {@link Carrier}. */
public enum CarrierStrategy {
  /** {@code java.lang.ScopedValue}: binding lives exactly as long as the call that made it. */
  SCOPED_VALUE("scoped-value"),

  /** One {@link ThreadLocal} slot per thread, saved and restored around each call. */
  THREAD_LOCAL("thread-local");

  private final String id;

  CarrierStrategy(String id) {
    this.id = id;
  }

  /** Configuration id, as accepted by {@link #fromId(String)}. */
  public String id() {
    return id;
  }

  public static CarrierStrategy fromId(String id) {
    String s = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
    for (CarrierStrategy c : values()) {
      if (c.id.equals(s)) return c;
    }
    throw new IllegalArgumentException("Unknown carrier strategy: " + id);
  }
}
