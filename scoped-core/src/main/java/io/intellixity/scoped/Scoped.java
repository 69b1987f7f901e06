package io.intellixity.scoped;

import io.intellixity.scoped.carrier.CarrierStrategy;
import io.intellixity.scoped.carrier.Carriers;
import io.intellixity.scoped.key.BindingKey;
import io.intellixity.scoped.key.UnboundKeyException;
import io.intellixity.scoped.map.ScopeMap;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Entry points for dynamically-scoped values.\n
 *
 * <pre>
 * static final BindingKey&lt;String&gt; TENANT = BindingKey.withRoot("tenant", "default");
 *
 * Scoped.where(TENANT, "acme").run(() -&gt; {
 *   assert TENANT.get().equals("acme");
 * });
 * </pre>
 *
 * Bindings are visible to everything the body calls on the same thread and are gone once it
 * returns. Other threads do not see them unless the caller hands over {@link #currentScope()} and
 * the other thread installs it with {@link #withScope(ScopeMap, Supplier)}.\n
 */
public final class Scoped {
  private Scoped() {}

  private static final Object NOT_FOUND = new Object();

  /** Scope active on this thread; {@link ScopeMap#empty()} if none. */
  public static ScopeMap currentScope() {
    return Carriers.carrier().current();
  }

  /** New scope with the alternating key/value pairs applied; does not touch the carrier. */
  public static ScopeMap extendScope(ScopeMap scope, Object... keysAndValues) {
    Objects.requireNonNull(scope, "scope");
    return scope.extend(keysAndValues);
  }

  public static <T> ScopeMap extendScope(ScopeMap scope, BindingKey<T> key, T value) {
    Objects.requireNonNull(scope, "scope");
    return scope.with(key, value);
  }

  /** Run {@code body} with {@code scope} installed and return its result. */
  public static <T> T withScope(ScopeMap scope, Supplier<T> body) {
    Objects.requireNonNull(body, "body");
    return Carriers.carrier().call(scope, body::get);
  }

  public static void runWithScope(ScopeMap scope, Runnable body) {
    Objects.requireNonNull(body, "body");
    Carriers.carrier().call(scope, () -> {
      body.run();
      return null;
    });
  }

  /** Like {@link #withScope(ScopeMap, Supplier)}; checked exceptions from the body pass through. */
  public static <T> T callWithScope(ScopeMap scope, Callable<T> body) throws Exception {
    Objects.requireNonNull(body, "body");
    return Carriers.carrier().call(scope, body::call);
  }

  /** Start a {@link Scoping} that extends the current scope with {@code key = value}. */
  public static <T> Scoping where(BindingKey<T> key, T value) {
    return Scoping.EMPTY.where(key, value);
  }

  /**
   * Start a {@link Scoping} from alternating key/value pairs.\n
   *
   * @throws IllegalArgumentException for an odd element count or a non-key in key position
   */
  public static Scoping scoping(Object... keysAndValues) {
    return Scoping.of(keysAndValues);
  }

  /**
   * Value of {@code key}: the active scope's binding if present (even when null), else the key's
   * root.\n
   *
   * @throws UnboundKeyException if neither exists
   */
  @SuppressWarnings("unchecked")
  public static <T> T ask(BindingKey<T> key) {
    Objects.requireNonNull(key, "key");
    Object v = Carriers.carrier().current().getOrDefault(key, NOT_FOUND);
    if (v != NOT_FOUND) return (T) v;
    return key.root();
  }

  /** As {@link #ask(BindingKey)}, returning {@code defaultValue} instead of failing. */
  @SuppressWarnings("unchecked")
  public static <T> T ask(BindingKey<T> key, T defaultValue) {
    Objects.requireNonNull(key, "key");
    Object v = Carriers.carrier().current().getOrDefault(key, NOT_FOUND);
    if (v != NOT_FOUND) return (T) v;
    return key.hasRoot() ? key.root() : defaultValue;
  }

  /** Strategy of the process-wide carrier. */
  public static CarrierStrategy carrierStrategy() {
    return Carriers.carrier().strategy();
  }
}
