package com.onthegomap.elapsed.stats;

import com.onthegomap.elapsed.util.DurationFormat;
import com.onthegomap.elapsed.util.Exceptions;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.LongConsumer;
import java.util.function.Supplier;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utilities for timing blocks of code and futures, and reporting how long they took.
 * <p>
 * {@link #timePrettyFormat(String, Consumer, SupplierThatThrows)} is probably the method you want, it turns the
 * elapsed time into a human-readable string to log:
 *
 * <pre>
 * {@code
 * var tiles = Timing.DEFAULT.timePrettyFormat("Rendered tiles in %s", LOGGER::info, () -> render(features));
 * }
 * </pre>
 * <p>
 * Would log something like "Rendered tiles in 1.204 s". The synchronous methods only report when the body returns
 * normally, and the future methods report once the future completes either way.
 */
@ThreadSafe
public class Timing {

  private static final Logger LOGGER = LoggerFactory.getLogger(Timing.class);

  /** Instance backed by {@link Clock#SYSTEM} that formats decimals with {@link Locale#ROOT}. */
  public static final Timing DEFAULT = create();

  private final Clock clock;
  private final DurationFormat format;

  private Timing(Clock clock, DurationFormat format) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.format = format;
  }

  public static Timing create() {
    return create(Clock.SYSTEM);
  }

  public static Timing create(Clock clock) {
    return create(clock, Locale.ROOT);
  }

  /** Returns a new instance that reads {@code clock} and formats durations for {@code locale}. */
  public static Timing create(Clock clock, Locale locale) {
    return new Timing(clock, DurationFormat.forLocale(locale));
  }

  public Clock clock() {
    return clock;
  }

  public DurationFormat format() {
    return format;
  }

  /** Returns {@code nanos} as a human-readable string like {@code "372 ns"}. */
  public String pretty(long nanos) {
    return format.format(nanos);
  }

  /**
   * Runs {@code body} and passes the elapsed nanoseconds to {@code report}.
   * <p>
   * If {@code body} throws, the exception propagates and {@code report} is not called.
   *
   * @return the value {@code body} returned
   * @throws E whatever {@code body} throws
   */
  public <T, E extends Exception> T time(LongConsumer report, SupplierThatThrows<T, E> body) throws E {
    Objects.requireNonNull(report, "report");
    long start = clock.nanoTime();
    T result = body.get();
    report.accept(clock.nanoTime() - start);
    return result;
  }

  /** Like {@link #time(LongConsumer, SupplierThatThrows)} but reports a string like {@code "1.500 ms"}. */
  public <T, E extends Exception> T timePretty(Consumer<String> report, SupplierThatThrows<T, E> body) throws E {
    return time(prettyReporter(report), body);
  }

  /**
   * Like {@link #timePretty(Consumer, SupplierThatThrows)} but substitutes the pretty string into {@code template}
   * before reporting it.
   *
   * @throws java.util.IllegalFormatException if {@code template} is malformed, after {@code body} ran
   */
  public <T, E extends Exception> T timePrettyFormat(String template, Consumer<String> report,
    SupplierThatThrows<T, E> body) throws E {
    return timePretty(templateReporter(template, report), body);
  }

  /**
   * Times the completion of the future that {@code future} produces and passes the elapsed nanoseconds to
   * {@code report} on {@code executor}.
   * <p>
   * The clock starts before {@code future} is called, and {@code report} is called once when the future completes
   * successfully or exceptionally.
   *
   * @return the same future {@code future} produced, without waiting for it
   */
  public <T, F extends CompletionStage<T>> F timeFuture(LongConsumer report, Supplier<F> future, Executor executor) {
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(executor, "executor");
    long start = clock.nanoTime();
    F result = future.get();
    result.whenCompleteAsync(observer(report, start), executor);
    return result;
  }

  /**
   * Like {@link #timeFuture(LongConsumer, Supplier, Executor)} but runs {@code report} on the future's default
   * asynchronous execution facility.
   */
  public <T, F extends CompletionStage<T>> F timeFuture(LongConsumer report, Supplier<F> future) {
    Objects.requireNonNull(report, "report");
    long start = clock.nanoTime();
    F result = future.get();
    result.whenCompleteAsync(observer(report, start));
    return result;
  }

  /** Like {@link #timeFuture(LongConsumer, Supplier, Executor)} but reports a string like {@code "1.500 ms"}. */
  public <T, F extends CompletionStage<T>> F timeFuturePretty(Consumer<String> report, Supplier<F> future,
    Executor executor) {
    return timeFuture(prettyReporter(report), future, executor);
  }

  /** Like {@link #timeFuture(LongConsumer, Supplier)} but reports a string like {@code "1.500 ms"}. */
  public <T, F extends CompletionStage<T>> F timeFuturePretty(Consumer<String> report, Supplier<F> future) {
    return timeFuture(prettyReporter(report), future);
  }

  /**
   * Like {@link #timeFuturePretty(Consumer, Supplier, Executor)} but substitutes the pretty string into
   * {@code template} before reporting it.
   * <p>
   * A malformed {@code template} is logged when the future completes and does not affect the returned future.
   */
  public <T, F extends CompletionStage<T>> F timeFuturePrettyFormat(String template, Consumer<String> report,
    Supplier<F> future, Executor executor) {
    return timeFuturePretty(templateReporter(template, report), future, executor);
  }

  /** Like {@link #timeFuturePretty(Consumer, Supplier)} but substitutes the pretty string into {@code template}. */
  public <T, F extends CompletionStage<T>> F timeFuturePrettyFormat(String template, Consumer<String> report,
    Supplier<F> future) {
    return timeFuturePretty(templateReporter(template, report), future);
  }

  private LongConsumer prettyReporter(Consumer<String> report) {
    Objects.requireNonNull(report, "report");
    return nanos -> report.accept(format.format(nanos));
  }

  private Consumer<String> templateReporter(String template, Consumer<String> report) {
    Objects.requireNonNull(template, "template");
    Objects.requireNonNull(report, "report");
    return pretty -> report.accept(String.format(format.locale(), template, pretty));
  }

  private <T> BiConsumer<T, Throwable> observer(LongConsumer report, long start) {
    return (result, failure) -> {
      long elapsed = clock.nanoTime() - start;
      if (failure != null) {
        LOGGER.debug("Timed future failed after {}", format.format(elapsed), Exceptions.unwrap(failure));
      }
      try {
        report.accept(elapsed);
      } catch (RuntimeException e) {
        // the returned future has already completed, so this is the only place the error can go
        LOGGER.warn("Error reporting elapsed time of future", e);
      }
    };
  }
}
