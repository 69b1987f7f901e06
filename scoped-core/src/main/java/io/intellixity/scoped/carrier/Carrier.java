package io.intellixity.scoped.carrier;

import io.intellixity.scoped.map.ScopeMap;

/**
 * Storage cell for the active {@link ScopeMap}.\n
 *
 * A carrier is shared by the whole process but partitioned per thread: each thread only ever sees
 * the scope most recently installed on that thread. Installing on one thread never affects another;
 * to carry a scope across, read it with {@link #current()} and install it again on the other side.\n
 *
 * The only mutation is {@link #call(ScopeMap, ScopedBody)}, which is strictly nested: the previous
 * scope is back in place when it returns, whatever way the body exits.\n
 */
public interface Carrier {

  /** Scope active on the calling thread, or {@link ScopeMap#empty()} if none was installed. */
  ScopeMap current();

  /**
   * Install {@code scope} for the dynamic extent of {@code body}.\n
   *
   * Returns the body's result. Anything the body throws propagates unchanged, after the previous
   * scope has been restored.\n
   */
  <T, X extends Exception> T call(ScopeMap scope, ScopedBody<T, X> body) throws X;

  CarrierStrategy strategy();
}
