package com.onthegomap.elapsed.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Exception-handling utilities.
 */
public class Exceptions {
  private Exceptions() {}

  /**
   * Strips the {@link CompletionException} and {@link ExecutionException} wrappers that futures add around the
   * failure of the underlying task.
   *
   * @param exception The exception a future completed with
   * @return the innermost cause, or {@code exception} itself if it is not wrapped
   */
  public static Throwable unwrap(Throwable exception) {
    Throwable result = exception;
    while ((result instanceof CompletionException || result instanceof ExecutionException) &&
      result.getCause() != null) {
      result = result.getCause();
    }
    return result;
  }
}
