package io.intellixity.scoped.carrier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Picks the carrier strategy for the process.\n
 *
 * Configuration:\n
 * - {@value #CARRIER_PROPERTY}: {@code auto} (default), {@code scoped-value} or {@code thread-local}\n
 * - {@value #FORCE_FALLBACK_PROPERTY}=true or env {@value #FORCE_FALLBACK_ENV}=true: always use
 *   {@link ThreadLocalCarrier}\n
 *
 * {@code auto} uses {@link ScopedValueCarrier} when the JVM offers it and {@link ThreadLocalCarrier}
 * otherwise. {@link Carriers} runs the selection once; nothing re-checks it afterwards.\n
 */
public final class CarrierSelector {
  private static final Logger log = LoggerFactory.getLogger(CarrierSelector.class);

  public static final String CARRIER_PROPERTY = "io.intellixity.scoped.carrier";
  public static final String FORCE_FALLBACK_PROPERTY = "io.intellixity.scoped.force-fallback";
  public static final String FORCE_FALLBACK_ENV = "SCOPED_FORCE_FALLBACK";
  public static final String AUTO = "auto";

  private CarrierSelector() {}

  /** Outcome of {@link #decide}: the strategy plus a human-readable reason for the log line. */
  public record Decision(CarrierStrategy strategy, String reason, boolean explicit) {
    public Decision {
      Objects.requireNonNull(strategy, "strategy");
      Objects.requireNonNull(reason, "reason");
    }
  }

  /**
   * Pure selection rule.\n
   *
   * @param requested            value of {@value #CARRIER_PROPERTY}; null or blank means {@code auto}
   * @param forceFallback        whether the fallback toggle is set
   * @param scopedValueAvailable whether the JVM offers the final ScopedValue API
   */
  public static Decision decide(String requested, boolean forceFallback, boolean scopedValueAvailable) {
    if (forceFallback) {
      return new Decision(CarrierStrategy.THREAD_LOCAL, "fallback forced", true);
    }
    if (requested == null || requested.isBlank() || AUTO.equalsIgnoreCase(requested.trim())) {
      return scopedValueAvailable
          ? new Decision(CarrierStrategy.SCOPED_VALUE, "ScopedValue available", false)
          : new Decision(CarrierStrategy.THREAD_LOCAL, "ScopedValue unavailable on Java " + Runtime.version().feature(), false);
    }
    CarrierStrategy s = CarrierStrategy.fromId(requested);
    if (s == CarrierStrategy.SCOPED_VALUE && !scopedValueAvailable) {
      throw new IllegalStateException(CARRIER_PROPERTY + "=" + s.id()
          + " but ScopedValue is unavailable on Java " + Runtime.version().feature());
    }
    return new Decision(s, CARRIER_PROPERTY + "=" + s.id(), true);
  }

  /** Select from JVM system properties and the process environment. */
  public static Carrier select() {
    return select(System.getProperties(), System.getenv(), ScopedValueCarrier.isAvailable());
  }

  static Carrier select(Properties props, Map<String, String> env, boolean scopedValueAvailable) {
    String requested = props.getProperty(CARRIER_PROPERTY);
    boolean forceFallback = isTrue(props.getProperty(FORCE_FALLBACK_PROPERTY)) || isTrue(env.get(FORCE_FALLBACK_ENV));
    if (forceFallback) log.debug("scoped carrier fallback forced by {} / {}", FORCE_FALLBACK_PROPERTY, FORCE_FALLBACK_ENV);

    Decision d = decide(requested, forceFallback, scopedValueAvailable);
    Carrier carrier = create(d);
    log.info("scoped carrier={} reason={}", carrier.strategy().id(), d.reason());
    return carrier;
  }

  /** Instantiate the carrier for a strategy. */
  public static Carrier create(CarrierStrategy strategy) {
    Objects.requireNonNull(strategy, "strategy");
    return switch (strategy) {
      case SCOPED_VALUE -> ScopedValueCarrier.create();
      case THREAD_LOCAL -> new ThreadLocalCarrier();
    };
  }

  private static Carrier create(Decision d) {
    if (d.strategy() != CarrierStrategy.SCOPED_VALUE || d.explicit()) return create(d.strategy());
    try {
      return ScopedValueCarrier.create();
    } catch (IllegalStateException e) {
      log.warn("scoped carrier: ScopedValue detected but could not be bound, using thread-local", e);
      return new ThreadLocalCarrier();
    }
  }

  private static boolean isTrue(String s) {
    return s != null && Boolean.parseBoolean(s.trim());
  }
}
