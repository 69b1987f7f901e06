package io.intellixity.scoped.concurrent;

import io.intellixity.scoped.Scoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/** Platform threads that start under the creating thread's scope. */
public final class ScopedThreads {
  private static final Logger log = LoggerFactory.getLogger(ScopedThreads.class);
  private static final AtomicLong SEQ = new AtomicLong();

  private ScopedThreads() {}

  /** Unstarted thread whose body runs with the scope captured now. */
  public static Thread newThread(String name, Runnable task) {
    Objects.requireNonNull(task, "task");
    String n = (name == null || name.isBlank()) ? ("scoped-" + SEQ.incrementAndGet()) : name;
    ScopeSnapshot snapshot = ScopedTasks.capture();
    if (log.isDebugEnabled()) {
      log.debug("scoped.thread create name={} bindings={} carrier={}",
          n, snapshot.scope().size(), Scoped.carrierStrategy().id());
    }
    return new Thread(snapshot.wrap(task), n);
  }

  public static Thread start(Runnable task) {
    Thread t = newThread(null, task);
    t.start();
    return t;
  }
}
