package io.intellixity.scoped.key;

/**
 * Raised when a key is read outside of any scope that binds it, its root is unbound and the caller
 * supplied no default.
 */
public final class UnboundKeyException extends IllegalStateException {
  private final transient BindingKey<?> key;

  public UnboundKeyException(BindingKey<?> key) {
    super("Unbound: " + key);
    this.key = key;
  }

  public BindingKey<?> key() {
    return key;
  }
}
