package com.onthegomap.elapsed.stats;

import com.onthegomap.elapsed.util.DurationFormat;
import java.time.Duration;
import java.util.Objects;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Measures the amount of time between {@link #start()} and {@link #stop()} for tasks that don't fit in a single
 * block.
 * <p>
 * For example:
 *
 * <pre>
 * {@code
 * var timer = Timer.start();
 * // do expensive work...
 * LOGGER.info("Expensive work took " + timer.stop());
 * }
 * </pre>
 */
@ThreadSafe
public class Timer {

  private final Clock clock;
  private final long start;
  private long end;
  private boolean stopped = false;

  private Timer(Clock clock) {
    this.clock = clock;
    this.start = clock.nanoTime();
  }

  /** Returns a new timer reading {@link Clock#SYSTEM} that starts counting now. */
  public static Timer start() {
    return start(Clock.SYSTEM);
  }

  /** Returns a new timer reading {@code clock} that starts counting now. */
  public static Timer start(Clock clock) {
    return new Timer(Objects.requireNonNull(clock, "clock"));
  }

  /**
   * Sets the end time to now, and makes {@link #running()} return false. Calling multiple times will extend the end
   * time.
   */
  public Timer stop() {
    synchronized (this) {
      end = clock.nanoTime();
      stopped = true;
    }
    return this;
  }

  /** Returns {@code false} if {@link #stop()} has been called. */
  public synchronized boolean running() {
    return !stopped;
  }

  /** Returns nanoseconds from start to now if the task is still running, or start to end if it has finished. */
  public long elapsedNanos() {
    synchronized (this) {
      if (stopped) {
        return end - start;
      }
    }
    return clock.nanoTime() - start;
  }

  public Duration elapsed() {
    return Duration.ofNanos(elapsedNanos());
  }

  @Override
  public String toString() {
    return DurationFormat.pretty(elapsedNanos());
  }
}
