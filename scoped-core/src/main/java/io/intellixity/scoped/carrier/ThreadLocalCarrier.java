package io.intellixity.scoped.carrier;

import io.intellixity.scoped.map.ScopeMap;

import java.util.Objects;

/**
 * Carrier backed by a {@link ThreadLocal}.\n
 *
 * The previous value is saved before installing and put back in a {@code finally} block, so the
 * restore runs once per call even when the body throws or the thread is interrupted.\n
 */
public final class ThreadLocalCarrier implements Carrier {
  private final ThreadLocal<ScopeMap> slot = ThreadLocal.withInitial(ScopeMap::empty);

  @Override
  public ScopeMap current() {
    return slot.get();
  }

  @Override
  public <T, X extends Exception> T call(ScopeMap scope, ScopedBody<T, X> body) throws X {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(body, "body");
    ScopeMap prev = slot.get();
    slot.set(scope);
    try {
      return body.run();
    } finally {
      // Empty is what a fresh thread reads anyway; dropping the entry keeps pooled threads clean.
      if (prev.isEmpty()) slot.remove();
      else slot.set(prev);
    }
  }

  @Override
  public CarrierStrategy strategy() {
    return CarrierStrategy.THREAD_LOCAL;
  }

  @Override
  public String toString() {
    return "ThreadLocalCarrier";
  }
}
