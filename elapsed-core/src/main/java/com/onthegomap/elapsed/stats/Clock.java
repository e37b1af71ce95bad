package com.onthegomap.elapsed.stats;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A source of monotonic nanosecond ticks.
 * <p>
 * Values are only meaningful relative to other values from the same clock, and are never affected by changes to the
 * wall clock.
 */
@FunctionalInterface
public interface Clock {

  /** Reads {@link System#nanoTime()}. */
  Clock SYSTEM = System::nanoTime;

  /** Returns the current instant in nanoseconds. */
  long nanoTime();

  /**
   * Returns a clock that replays {@code ticks} in order, then keeps returning the last one.
   *
   * @throws IllegalArgumentException if {@code ticks} is empty
   */
  static Clock ofSequence(long... ticks) {
    if (ticks.length == 0) {
      throw new IllegalArgumentException("Need at least one tick");
    }
    long[] copy = Arrays.copyOf(ticks, ticks.length);
    AtomicInteger idx = new AtomicInteger();
    return () -> copy[idx.getAndUpdate(i -> Math.min(i + 1, copy.length - 1))];
  }
}
