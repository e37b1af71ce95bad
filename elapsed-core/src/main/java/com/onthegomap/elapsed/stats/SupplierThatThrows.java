package com.onthegomap.elapsed.stats;

/**
 * A computation that produces a value and may throw a checked exception of type {@code E}.
 *
 * @param <T> type of the result
 * @param <E> type of exception the computation may throw, {@link RuntimeException} when it throws none
 */
@FunctionalInterface
public interface SupplierThatThrows<T, E extends Exception> {

  T get() throws E;
}
