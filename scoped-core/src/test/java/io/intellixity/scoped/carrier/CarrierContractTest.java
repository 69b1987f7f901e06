package io.intellixity.scoped.carrier;

import io.intellixity.scoped.key.BindingKey;
import io.intellixity.scoped.map.ScopeMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/** Behaviour every {@link Carrier} strategy must share. */
abstract class CarrierContractTest {
  static final BindingKey<String> K = BindingKey.withRoot("k", "root");

  Carrier carrier;

  protected abstract Carrier newCarrier();

  @BeforeEach
  void setUp() {
    carrier = newCarrier();
  }

  private static ScopeMap scope(String v) {
    return ScopeMap.empty().with(K, v);
  }

  @Test
  void current_isEmptyWhenNothingInstalled() {
    assertTrue(carrier.current().isEmpty());
    assertEquals(ScopeMap.empty(), carrier.current());
  }

  @Test
  void call_installsForTheExtent_andReturnsTheBodyResult() {
    ScopeMap s = scope("v");
    String out = carrier.call(s, () -> {
      assertSame(s, carrier.current());
      return "result";
    });
    assertEquals("result", out);
    assertTrue(carrier.current().isEmpty());
  }

  @Test
  void nesting_restoresOuterScopeOnExit() {
    ScopeMap outer = scope("outer");
    ScopeMap inner = scope("inner");
    carrier.call(outer, () -> {
      carrier.call(inner, () -> {
        assertEquals("inner", carrier.current().get(K));
        return null;
      });
      assertSame(outer, carrier.current());
      return null;
    });
    assertTrue(carrier.current().isEmpty());
  }

  @Test
  void nesting_isUnboundedlyDeep() {
    assertEquals(200, descend(0, 200));
    assertTrue(carrier.current().isEmpty());
  }

  private int descend(int depth, int max) {
    if (depth == max) return depth;
    ScopeMap s = scope("d" + depth);
    return carrier.call(s, () -> {
      int r = descend(depth + 1, max);
      assertSame(s, carrier.current());
      return r;
    });
  }

  @Test
  void runtimeFailure_propagatesSameInstance_afterRestore() {
    ScopeMap outer = scope("outer");
    IllegalStateException boom = new IllegalStateException("boom");
    carrier.call(outer, () -> {
      IllegalStateException thrown = assertThrows(IllegalStateException.class,
          () -> carrier.call(scope("inner"), () -> { throw boom; }));
      assertSame(boom, thrown);
      assertSame(outer, carrier.current());
      return null;
    });
  }

  @Test
  void checkedFailure_propagatesUnwrapped() {
    IOException io = new IOException("disk");
    IOException thrown = assertThrows(IOException.class,
        () -> carrier.call(scope("v"), () -> { throw io; }));
    assertSame(io, thrown);
    assertTrue(carrier.current().isEmpty());
  }

  @Test
  void error_propagates_afterRestore() {
    AssertionError err = new AssertionError("fatal");
    AssertionError thrown = assertThrows(AssertionError.class,
        () -> carrier.call(scope("v"), () -> { throw err; }));
    assertSame(err, thrown);
    assertTrue(carrier.current().isEmpty());
  }

  @Test
  void interruptedBody_stillRestores() {
    ScopeMap outer = scope("outer");
    carrier.call(outer, () -> {
      assertThrows(IllegalStateException.class, () -> carrier.call(scope("inner"), () -> {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("cancelled");
      }));
      assertTrue(Thread.interrupted());
      assertSame(outer, carrier.current());
      return null;
    });
  }

  @Test
  void installation_isNotVisibleOnAnotherThread() throws Exception {
    CountDownLatch installed = new CountDownLatch(1);
    CountDownLatch observed = new CountDownLatch(1);
    AtomicReference<ScopeMap> seen = new AtomicReference<>();

    Thread reader = new Thread(() -> {
      try {
        installed.await(5, TimeUnit.SECONDS);
        seen.set(carrier.current());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } finally {
        observed.countDown();
      }
    });
    reader.start();

    carrier.call(scope("main"), () -> {
      installed.countDown();
      assertTrue(observed.await(5, TimeUnit.SECONDS));
      return null;
    });
    reader.join();

    assertNotNull(seen.get());
    assertTrue(seen.get().isEmpty());
  }

  @Test
  void capturedScope_canBeReinstalledOnAnotherThread() throws Exception {
    ScopeMap captured = carrier.call(scope("handed-off"), carrier::current);
    AtomicReference<String> seen = new AtomicReference<>();
    Thread t = new Thread(() -> seen.set(carrier.call(captured, () -> carrier.current().get(K))));
    t.start();
    t.join();
    assertEquals("handed-off", seen.get());
  }

  @Test
  void concurrentThreads_eachSeeOnlyTheirOwnScope() throws Exception {
    ConcurrentLinkedQueue<String> mismatches = new ConcurrentLinkedQueue<>();
    List<Thread> threads = new ArrayList<>();
    CountDownLatch start = new CountDownLatch(1);
    for (int i = 0; i < 8; i++) {
      String mine = "t" + i;
      threads.add(new Thread(() -> {
        try {
          start.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        carrier.call(scope(mine), () -> {
          for (int n = 0; n < 1_000; n++) {
            String v = carrier.current().get(K);
            if (!mine.equals(v)) mismatches.add(mine + "!=" + v);
            if (n % 100 == 0) Thread.yield();
          }
          return null;
        });
        if (!carrier.current().isEmpty()) mismatches.add(mine + " leaked");
      }));
    }
    threads.forEach(Thread::start);
    start.countDown();
    for (Thread t : threads) t.join();
    assertTrue(mismatches.isEmpty(), mismatches::toString);
  }
}
