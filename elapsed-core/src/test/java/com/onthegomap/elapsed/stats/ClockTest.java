package com.onthegomap.elapsed.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ClockTest {

  @Test
  void testSystemClockIsMonotonic() {
    long last = Clock.SYSTEM.nanoTime();
    for (int i = 0; i < 1_000; i++) {
      long now = Clock.SYSTEM.nanoTime();
      assertTrue(now >= last, now + " < " + last);
      last = now;
    }
  }

  @Test
  void testSequenceRepeatsLastTick() {
    Clock clock = Clock.ofSequence(5, 10, 20);
    assertEquals(5, clock.nanoTime());
    assertEquals(10, clock.nanoTime());
    assertEquals(20, clock.nanoTime());
    assertEquals(20, clock.nanoTime());
    assertEquals(20, clock.nanoTime());
  }

  @Test
  void testSequenceCopiesInput() {
    long[] ticks = {1, 2};
    Clock clock = Clock.ofSequence(ticks);
    ticks[0] = 100;
    assertEquals(1, clock.nanoTime());
  }

  @Test
  void testEmptySequence() {
    assertThrows(IllegalArgumentException.class, () -> Clock.ofSequence());
  }
}
