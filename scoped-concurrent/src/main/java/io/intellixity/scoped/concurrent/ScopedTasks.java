package io.intellixity.scoped.concurrent;

import io.intellixity.scoped.Scoped;
import io.intellixity.scoped.map.ScopeMap;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Explicit scope hand-off for work scheduled on other threads.\n
 *
 * Tasks handed to an executor do not see the submitting thread's scope on their own. Every method
 * here captures {@link Scoped#currentScope()} at the moment it is called and installs that capture
 * when the task runs. Bindings made on the submitting thread afterwards are not observed.\n
 */
public final class ScopedTasks {
  private ScopedTasks() {}

  /** Capture the calling thread's scope. */
  public static ScopeSnapshot capture() {
    return new ScopeSnapshot(Scoped.currentScope());
  }

  /** Snapshot of an explicitly built scope. */
  public static ScopeSnapshot of(ScopeMap scope) {
    return new ScopeSnapshot(scope);
  }

  public static Runnable wrap(Runnable task) {
    return capture().wrap(task);
  }

  public static <T> Callable<T> wrapCallable(Callable<T> task) {
    return capture().wrapCallable(task);
  }

  public static <T> Supplier<T> wrapSupplier(Supplier<T> task) {
    return capture().wrapSupplier(task);
  }

  public static Runnable wrap(ScopeMap scope, Runnable task) {
    return of(scope).wrap(task);
  }

  public static <T> Callable<T> wrapCallable(ScopeMap scope, Callable<T> task) {
    return of(scope).wrapCallable(task);
  }

  public static <T> Supplier<T> wrapSupplier(ScopeMap scope, Supplier<T> task) {
    return of(scope).wrapSupplier(task);
  }

  public static void execute(Executor executor, Runnable task) {
    Objects.requireNonNull(executor, "executor");
    executor.execute(wrap(task));
  }

  public static <T> Future<T> submit(ExecutorService executor, Callable<T> task) {
    Objects.requireNonNull(executor, "executor");
    return executor.submit(wrapCallable(task));
  }

  public static <T> CompletableFuture<T> supplyAsync(Supplier<T> task, Executor executor) {
    Objects.requireNonNull(executor, "executor");
    return CompletableFuture.supplyAsync(wrapSupplier(task), executor);
  }

  public static CompletableFuture<Void> runAsync(Runnable task, Executor executor) {
    Objects.requireNonNull(executor, "executor");
    return CompletableFuture.runAsync(wrap(task), executor);
  }
}
