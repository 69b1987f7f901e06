package io.intellixity.scoped.concurrent;

import io.intellixity.scoped.Scoped;
import io.intellixity.scoped.map.ScopeMap;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * A captured {@link ScopeMap} plus helpers that reinstall it around tasks.\n
 *
 * Snapshots are immutable and can be shared by any number of threads.\n
 */
public final class ScopeSnapshot {
  private final ScopeMap scope;

  ScopeSnapshot(ScopeMap scope) {
    this.scope = Objects.requireNonNull(scope, "scope");
  }

  public ScopeMap scope() {
    return scope;
  }

  public Runnable wrap(Runnable task) {
    Objects.requireNonNull(task, "task");
    return () -> Scoped.runWithScope(scope, task);
  }

  public <T> Callable<T> wrapCallable(Callable<T> task) {
    Objects.requireNonNull(task, "task");
    return () -> Scoped.callWithScope(scope, task);
  }

  public <T> Supplier<T> wrapSupplier(Supplier<T> task) {
    Objects.requireNonNull(task, "task");
    return () -> Scoped.withScope(scope, task);
  }

  @Override
  public String toString() {
    return "ScopeSnapshot" + scope;
  }
}
