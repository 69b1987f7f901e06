package io.intellixity.scoped.key;

import io.intellixity.scoped.Scoped;

import java.util.Objects;

/**
 * Identity of a dynamically-scoped variable.\n
 *
 * A key carries a root value that applies whenever no active scope binds it. The root is either
 * bound (any value, {@code null} included) or unbound; an unbound key read outside of any scope
 * that binds it fails with {@link UnboundKeyException}.\n
 *
 * Keys compare by identity. The name is only used for diagnostics.\n
 */
public final class BindingKey<T> {
  private static final Object UNBOUND = new Object() {
    @Override public String toString() { return "<unbound>"; }
  };

  private final String name;
  private final Object root;

  private BindingKey(String name, Object root) {
    this.name = Objects.requireNonNull(name, "name");
    this.root = root;
  }

  /** Declare a key with no root value. */
  public static <T> BindingKey<T> unbound(String name) {
    return new BindingKey<>(name, UNBOUND);
  }

  /** Declare a key whose root value is {@code root} (may be null). */
  public static <T> BindingKey<T> withRoot(String name, T root) {
    return new BindingKey<>(name, root);
  }

  public String name() { return name; }

  /** True if the root value is bound (a {@code null} root counts as bound). */
  public boolean hasRoot() {
    return root != UNBOUND;
  }

  /** Root value; throws {@link UnboundKeyException} if the key was declared unbound. */
  @SuppressWarnings("unchecked")
  public T root() {
    if (root == UNBOUND) throw new UnboundKeyException(this);
    return (T) root;
  }

  /** Shortcut for {@link Scoped#ask(BindingKey)}. */
  public T get() {
    return Scoped.ask(this);
  }

  /** Shortcut for {@link Scoped#ask(BindingKey, Object)}. */
  public T orElse(T defaultValue) {
    return Scoped.ask(this, defaultValue);
  }

  @Override
  public String toString() {
    return "#'" + name;
  }
}
