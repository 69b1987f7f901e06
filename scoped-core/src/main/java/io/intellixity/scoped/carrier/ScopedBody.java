package io.intellixity.scoped.carrier;

/** Body run under an installed scope. {@code X} lets checked exceptions pass through unchanged. */
@FunctionalInterface
public interface ScopedBody<T, X extends Exception> {
  T run() throws X;
}
