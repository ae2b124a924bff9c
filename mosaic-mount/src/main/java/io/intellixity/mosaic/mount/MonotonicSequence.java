package io.intellixity.mosaic.mount;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/** Thread-safe increasing id source. */
public final class MonotonicSequence {
  private final AtomicLong next;

  public MonotonicSequence(long start) {
    if (start < 0) throw new IllegalArgumentException("start must be >= 0");
    this.next = new AtomicLong(start);
  }

  /** Starts at a random point so ids from an earlier process are unlikely to be valid in this one. */
  public static MonotonicSequence randomStart() {
    return new MonotonicSequence(ThreadLocalRandom.current().nextLong(0, 1L << 48));
  }

  public long next() {
    long v = next.getAndIncrement();
    if (v < 0) throw new IllegalStateException("sequence exhausted");
    return v;
  }
}
