package com.onthegomap.elapsed.util.log4j;

import com.onthegomap.elapsed.stats.Clock;
import com.onthegomap.elapsed.util.DurationFormat;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.lookup.StrLookup;

/**
 * A log4j plugin that substitutes {@code $${uptime:now}} pattern with the elapsed time of the program, formatted like
 * {@code "1.204 s"} or {@code "00:12:07"}.
 * <p>
 * log4j properties file needs to include {@code packages=com.onthegomap.elapsed.util.log4j} to look in this package
 * for plugins.
 */
@Plugin(name = "uptime", category = StrLookup.CATEGORY)
public class UptimeLookupPlugin implements StrLookup {

  // rough approximation for start time: when log4j first loads this plugin
  private static final long START_TIME = Clock.SYSTEM.nanoTime();

  private final Clock clock;
  private final long startTime;

  public UptimeLookupPlugin() {
    this(Clock.SYSTEM, START_TIME);
  }

  UptimeLookupPlugin(Clock clock, long startTime) {
    this.clock = clock;
    this.startTime = startTime;
  }

  @Override
  public String lookup(String key) {
    return DurationFormat.pretty(clock.nanoTime() - startTime);
  }

  @Override
  public String lookup(LogEvent event, String key) {
    return lookup(key);
  }
}
