package io.intellixity.scoped.carrier;

import io.intellixity.scoped.map.ScopeMap;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.Objects;

/**
 * Carrier backed by {@code java.lang.ScopedValue}.\n
 *
 * The build targets a release that predates the final ScopedValue API, so the class is bound
 * through method handles resolved once in {@link #create()}. Each {@link #call} runs the body via
 * {@code ScopedValue.where(sv, scope).run(...)}; the runtime drops the binding when that returns,
 * so there is no restore step here.\n
 *
 * Bindings are inherited by StructuredTaskScope forks of the installing call, but not by threads
 * or executor tasks started independently.\n
 */
public final class ScopedValueCarrier implements Carrier {
  static final String SCOPED_VALUE_CLASS = "java.lang.ScopedValue";
  /** First feature release where ScopedValue is a final (non-preview) API. */
  static final int MIN_FEATURE_VERSION = 25;

  private final Object scopedValue;
  /** (ScopedValue, Object) -> ScopedValue.Carrier */
  private final MethodHandle where;
  /** (ScopedValue.Carrier, Runnable) -> void */
  private final MethodHandle run;
  /** (ScopedValue, Object) -> Object */
  private final MethodHandle orElse;

  private ScopedValueCarrier(Object scopedValue, MethodHandle where, MethodHandle run, MethodHandle orElse) {
    this.scopedValue = scopedValue;
    this.where = where;
    this.run = run;
    this.orElse = orElse;
  }

  /** True when the running JVM provides the final ScopedValue API. */
  public static boolean isAvailable() {
    if (Runtime.version().feature() < MIN_FEATURE_VERSION) return false;
    try {
      Class.forName(SCOPED_VALUE_CLASS, false, ClassLoader.getSystemClassLoader());
      return true;
    } catch (ClassNotFoundException e) {
      return false;
    }
  }

  /**
   * Create a carrier around a fresh ScopedValue instance.\n
   *
   * @throws IllegalStateException if the runtime has no usable ScopedValue
   */
  public static ScopedValueCarrier create() {
    if (!isAvailable()) {
      throw new IllegalStateException("ScopedValue requires Java " + MIN_FEATURE_VERSION
          + "+, running " + Runtime.version());
    }
    try {
      MethodHandles.Lookup lookup = MethodHandles.publicLookup();
      Class<?> svType = Class.forName(SCOPED_VALUE_CLASS);
      Class<?> carrierType = Class.forName(SCOPED_VALUE_CLASS + "$Carrier");

      MethodHandle newInstance = lookup.findStatic(svType, "newInstance", MethodType.methodType(svType));
      MethodHandle where = lookup.findStatic(svType, "where", MethodType.methodType(carrierType, svType, Object.class))
          .asType(MethodType.methodType(Object.class, Object.class, Object.class));
      MethodHandle run = lookup.findVirtual(carrierType, "run", MethodType.methodType(void.class, Runnable.class))
          .asType(MethodType.methodType(void.class, Object.class, Runnable.class));
      MethodHandle orElse = lookup.findVirtual(svType, "orElse", MethodType.methodType(Object.class, Object.class))
          .asType(MethodType.methodType(Object.class, Object.class, Object.class));

      Object sv = newInstance.invoke();
      return new ScopedValueCarrier(sv, where, run, orElse);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new IllegalStateException("Failed to bind " + SCOPED_VALUE_CLASS, t);
    }
  }

  @Override
  public ScopeMap current() {
    try {
      return (ScopeMap) (Object) orElse.invokeExact(scopedValue, (Object) ScopeMap.empty());
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new IllegalStateException("ScopedValue.orElse failed", t);
    }
  }

  @Override
  public <T, X extends Exception> T call(ScopeMap scope, ScopedBody<T, X> body) throws X {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(body, "body");

    Outcome<T> outcome = new Outcome<>();
    Runnable op = () -> {
      try {
        outcome.value = body.run();
      } catch (Throwable t) {
        outcome.failure = t;
      }
    };

    try {
      Object bound = (Object) where.invokeExact(scopedValue, (Object) scope);
      run.invokeExact(bound, op);
    } catch (RuntimeException | Error e) {
      // Raised by the ScopedValue runtime itself (e.g. structure violations); the body's own
      // failures are captured in outcome.
      throw e;
    } catch (Throwable t) {
      throw new IllegalStateException("ScopedValue binding failed", t);
    }
    return outcome.<X>get();
  }

  @Override
  public CarrierStrategy strategy() {
    return CarrierStrategy.SCOPED_VALUE;
  }

  @Override
  public String toString() {
    return "ScopedValueCarrier";
  }

  private static final class Outcome<T> {
    T value;
    Throwable failure;

    @SuppressWarnings("unchecked")
    <X extends Exception> T get() throws X {
      Throwable t = failure;
      if (t == null) return value;
      if (t instanceof RuntimeException) throw (RuntimeException) t;
      if (t instanceof Error) throw (Error) t;
      // ScopedBody only declares X, so any other checked throwable is an X.
      throw (X) t;
    }
  }
}
