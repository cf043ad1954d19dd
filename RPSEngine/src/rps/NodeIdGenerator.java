package rps;

import java.util.concurrent.atomic.AtomicLong;

import com.google.common.annotations.VisibleForTesting;

/** Hands out {@link NodeId}s. Safe to share between threads. */
public final class NodeIdGenerator {
  private final AtomicLong counter = new AtomicLong();

  public NodeId next() {
    return NodeId.of(counter.incrementAndGet());
  }

  @VisibleForTesting
  void reset() {
    counter.set(0);
  }
}
