package com.onthegomap.elapsed.util;

import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Reporter callbacks that send formatted timing messages to an SLF4J {@link Logger}.
 * <p>
 * For example:
 *
 * <pre>
 * {@code
 * Timing.DEFAULT.timePrettyFormat("Sorted features in %s", Reporters.debug(LOGGER), () -> sort(features));
 * }
 * </pre>
 */
public class Reporters {
  private Reporters() {}

  public static Consumer<String> trace(Logger logger) {
    return atLevel(logger, Level.TRACE);
  }

  public static Consumer<String> debug(Logger logger) {
    return atLevel(logger, Level.DEBUG);
  }

  public static Consumer<String> info(Logger logger) {
    return atLevel(logger, Level.INFO);
  }

  public static Consumer<String> warn(Logger logger) {
    return atLevel(logger, Level.WARN);
  }

  /** Returns a reporter that logs each message to {@code logger} at {@code level}. */
  public static Consumer<String> atLevel(Logger logger, Level level) {
    Objects.requireNonNull(logger, "logger");
    Objects.requireNonNull(level, "level");
    return switch (level) {
      case TRACE -> logger::trace;
      case DEBUG -> logger::debug;
      case INFO -> logger::info;
      case WARN -> logger::warn;
      case ERROR -> logger::error;
    };
  }
}
