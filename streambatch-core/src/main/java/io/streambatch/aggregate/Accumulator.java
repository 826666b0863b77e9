package io.streambatch.aggregate;

/**
 * Running state of one aggregate function for one group.
 *
 * <p>Accumulators are built per batch and merged into the running state, so {@link #merge} must
 * be associative and commutative. Null inputs never reach an accumulator.
 */
public interface Accumulator {

  /** The function this accumulator computes. */
  AggregateFunction function();

  /**
   * Adds one non-null normalized value.
   *
   * @param value a {@link Long}, {@link Double}, {@link String} or {@link Boolean}
   */
  void add(Object value);

  /**
   * Folds another accumulator of the same kind into this one.
   *
   * @throws IllegalStateException if {@code other} is of a different kind
   */
  void merge(Accumulator other);

  /** Final value, or null when the function has no value (mean, min or max of no input). */
  Object result();
}
