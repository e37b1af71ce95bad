package com.onthegomap.elapsed.util;

import java.text.DecimalFormatSymbols;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Formats elapsed nanosecond counts as strings like {@code "372 ns"}, {@code "1.500 ms"}, {@code "00:01:30"} or
 * {@code "45 days 08:55:01"}.
 * <p>
 * Sub-minute durations pick the largest unit that keeps the value non-zero and print it as an integer when it divides
 * evenly, otherwise with 3 fractional digits. Only the decimal separator comes from the locale the instance was
 * created for, digits are always ASCII.
 */
@ThreadSafe
public class DurationFormat {

  private static final long NANOS_PER_MICRO = 1_000L;
  private static final long NANOS_PER_MILLI = 1_000_000L;
  private static final long NANOS_PER_SECOND = 1_000_000_000L;
  private static final long SECONDS_PER_MINUTE = 60L;
  private static final long SECONDS_PER_HOUR = 60L * SECONDS_PER_MINUTE;
  private static final long SECONDS_PER_DAY = 24L * SECONDS_PER_HOUR;
  // Duration#toNanos overflows a long past ~292 years
  private static final long MAX_NANO_SECONDS = Long.MAX_VALUE / NANOS_PER_SECOND;

  private static final ConcurrentMap<Locale, DurationFormat> instances = new ConcurrentHashMap<>();
  private static final DurationFormat ROOT = forLocale(Locale.ROOT);

  private final Locale locale;
  private final char decimalSeparator;

  private DurationFormat(Locale locale) {
    this.locale = locale;
    this.decimalSeparator = DecimalFormatSymbols.getInstance(locale).getDecimalSeparator();
  }

  /** Returns a cached formatter that uses the decimal separator of {@code locale}. */
  public static DurationFormat forLocale(Locale locale) {
    return instances.computeIfAbsent(Objects.requireNonNull(locale, "locale"), DurationFormat::new);
  }

  /** Returns the formatter for {@link Locale#ROOT}, which always uses {@code .} as the decimal separator. */
  public static DurationFormat defaultInstance() {
    return ROOT;
  }

  /** Shortcut for {@code defaultInstance().format(nanos)}. */
  public static String pretty(long nanos) {
    return ROOT.format(nanos);
  }

  /** Shortcut for {@code defaultInstance().format(duration)}. */
  public static String pretty(Duration duration) {
    return ROOT.format(duration);
  }

  public Locale locale() {
    return locale;
  }

  /**
   * Alias for {@link #format(long)} that takes a {@link Duration}, including ones too long to count in nanoseconds.
   */
  public String format(Duration duration) {
    long seconds = duration.getSeconds();
    if (seconds >= MAX_NANO_SECONDS || seconds <= -MAX_NANO_SECONDS) {
      return clock(seconds);
    }
    return format(duration.toNanos());
  }

  /**
   * Returns {@code nanos} as a human-readable string.
   * <p>
   * Never throws. Output for negative values is not meant to be read by humans.
   */
  public String format(long nanos) {
    long us = nanos / NANOS_PER_MICRO;
    long ms = nanos / NANOS_PER_MILLI;
    long s = nanos / NANOS_PER_SECOND;

    // order matters: exact multiples must be checked before the fractional form of the same tier
    if (us == 0 && ms == 0 && s == 0) {
      return nanos + " ns";
    } else if (ms == 0 && s == 0) {
      return nanos == us * 1000 ? us + " us" : decimal(nanos) + " us";
    } else if (s == 0) {
      return us == ms * 1000 ? ms + " ms" : decimal(us) + " ms";
    } else if (s < 60) {
      return ms == s * 1000 ? s + " s" : decimal(ms) + " s";
    }
    return clock(s);
  }

  /** Returns {@code thousandths / 1000} with exactly 3 fractional digits and this locale's decimal separator. */
  private String decimal(long thousandths) {
    return String.format(Locale.ROOT, "%.3f", thousandths / 1000d).replace('.', decimalSeparator);
  }

  private static String clock(long seconds) {
    long days = seconds / SECONDS_PER_DAY;
    long hours = seconds % SECONDS_PER_DAY / SECONDS_PER_HOUR;
    long minutes = seconds % SECONDS_PER_HOUR / SECONDS_PER_MINUTE;
    long secs = seconds % SECONDS_PER_MINUTE;
    String hms = String.format(Locale.ROOT, "%02d:%02d:%02d", hours, minutes, secs);
    return days == 0 ? hms : days + " days " + hms;
  }
}
