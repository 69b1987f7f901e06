package io.intellixity.scoped.key;

import java.util.Objects;

/** A single key/value pair to apply to a scope. The value may be null. */
public record Binding<T>(BindingKey<T> key, T value) {
  public Binding {
    Objects.requireNonNull(key, "key");
  }
}
