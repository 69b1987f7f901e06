package io.intellixity.scoped;

import io.intellixity.scoped.carrier.Carriers;
import io.intellixity.scoped.key.Binding;
import io.intellixity.scoped.key.BindingKey;
import io.intellixity.scoped.map.ScopeMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Immutable list of pending bindings.\n
 *
 * Running a body through {@link #get}, {@link #run} or {@link #call} extends the scope active at
 * that moment with these bindings (later ones win) and installs the result for the body.\n
 */
public final class Scoping {
  static final Scoping EMPTY = new Scoping(List.of());

  private final List<Binding<?>> bindings;

  private Scoping(List<Binding<?>> bindings) {
    this.bindings = bindings;
  }

  @SuppressWarnings("unchecked")
  static Scoping of(Object... keysAndValues) {
    ScopeMap.validatePairs(keysAndValues);
    List<Binding<?>> out = new ArrayList<>(keysAndValues.length / 2);
    for (int i = 0; i < keysAndValues.length; i += 2) {
      out.add(new Binding<>((BindingKey<Object>) keysAndValues[i], keysAndValues[i + 1]));
    }
    return out.isEmpty() ? EMPTY : new Scoping(List.copyOf(out));
  }

  /** New scoping with one more binding; this instance is unchanged. */
  public <T> Scoping where(BindingKey<T> key, T value) {
    Binding<T> b = new Binding<>(key, value);
    List<Binding<?>> out = new ArrayList<>(bindings.size() + 1);
    out.addAll(bindings);
    out.add(b);
    return new Scoping(out);
  }

  public List<Binding<?>> bindings() {
    return List.copyOf(bindings);
  }

  /** The scope the body would run under if executed now. */
  public ScopeMap scope() {
    return Scoped.currentScope().extend(bindings);
  }

  public <T> T get(Supplier<T> body) {
    Objects.requireNonNull(body, "body");
    return Carriers.carrier().call(scope(), body::get);
  }

  public void run(Runnable body) {
    Objects.requireNonNull(body, "body");
    Carriers.carrier().call(scope(), () -> {
      body.run();
      return null;
    });
  }

  public <T> T call(Callable<T> body) throws Exception {
    Objects.requireNonNull(body, "body");
    return Carriers.carrier().call(scope(), body::call);
  }

  @Override
  public String toString() {
    return "Scoping" + bindings;
  }
}
