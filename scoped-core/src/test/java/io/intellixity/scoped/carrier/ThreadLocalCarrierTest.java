package io.intellixity.scoped.carrier;

import io.intellixity.scoped.map.ScopeMap;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ThreadLocalCarrierTest extends CarrierContractTest {

  @Override
  protected Carrier newCarrier() {
    return new ThreadLocalCarrier();
  }

  @Test
  void strategy_isThreadLocal() {
    assertEquals(CarrierStrategy.THREAD_LOCAL, carrier.strategy());
  }

  @Test
  void separateInstances_doNotShareSlots() {
    Carrier other = new ThreadLocalCarrier();
    carrier.call(ScopeMap.empty().with(K, "mine"), () -> {
      assertTrue(other.current().isEmpty());
      return null;
    });
  }

  @Test
  void restoringTheEmptyScope_readsBackAsTheEmptySingleton() {
    carrier.call(ScopeMap.empty().with(K, "v"), () -> null);
    assertSame(ScopeMap.empty(), carrier.current());
  }
}
