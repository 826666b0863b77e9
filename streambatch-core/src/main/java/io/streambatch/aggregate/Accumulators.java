package io.streambatch.aggregate;

import io.streambatch.ColumnValues;
import io.streambatch.StreamBatchException;
import java.math.BigDecimal;
import java.math.MathContext;

/** Factory for the built-in {@link Accumulator} kinds. */
public final class Accumulators {

  private Accumulators() {}

  /**
   * Creates an empty accumulator.
   *
   * @param function the aggregate function
   * @param integerInput whether the input column holds integers; selects a long or double sum
   */
  public static Accumulator create(AggregateFunction function, boolean integerInput) {
    switch (function) {
      case SUM:
        return integerInput ? new LongSum() : new DoubleSum();
      case COUNT:
        return new Count();
      case MEAN:
        return new Mean(integerInput);
      case MIN:
        return new Extreme(AggregateFunction.MIN);
      case MAX:
        return new Extreme(AggregateFunction.MAX);
      default:
        throw new IllegalArgumentException("Unhandled function " + function);
    }
  }

  private static <T extends Accumulator> T sameKind(Accumulator self, Accumulator other) {
    if (other.getClass() != self.getClass() || other.function() != self.function()) {
      throw new IllegalStateException(
          "Cannot merge " + other.function() + " state into " + self.function() + " state");
    }
    @SuppressWarnings("unchecked")
    T cast = (T) other;
    return cast;
  }

  /**
   * Adds two integer partial sums.
   *
   * @throws StreamBatchException if the sum leaves the range of a long
   */
  static long addExact(long left, long right, AggregateFunction function) {
    try {
      return Math.addExact(left, right);
    } catch (ArithmeticException e) {
      throw new StreamBatchException(
          "Integer " + function.functionName() + " overflowed the range of a 64-bit integer", e);
    }
  }

  static final class LongSum implements Accumulator {
    private long sum;

    @Override
    public AggregateFunction function() {
      return AggregateFunction.SUM;
    }

    @Override
    public void add(Object value) {
      sum = addExact(sum, ((Number) value).longValue(), AggregateFunction.SUM);
    }

    @Override
    public void merge(Accumulator other) {
      LongSum that = sameKind(this, other);
      sum = addExact(sum, that.sum, AggregateFunction.SUM);
    }

    @Override
    public Object result() {
      return sum;
    }
  }

  static final class DoubleSum implements Accumulator {
    private double sum;

    @Override
    public AggregateFunction function() {
      return AggregateFunction.SUM;
    }

    @Override
    public void add(Object value) {
      sum += ((Number) value).doubleValue();
    }

    @Override
    public void merge(Accumulator other) {
      DoubleSum that = sameKind(this, other);
      sum += that.sum;
    }

    @Override
    public Object result() {
      return sum;
    }
  }

  static final class Count implements Accumulator {
    private long count;

    @Override
    public AggregateFunction function() {
      return AggregateFunction.COUNT;
    }

    @Override
    public void add(Object value) {
      count++;
    }

    @Override
    public void merge(Accumulator other) {
      Count that = sameKind(this, other);
      count += that.count;
    }

    @Override
    public Object result() {
      return count;
    }
  }

  /**
   * Keeps a (sum, count) pair; the division happens only in {@link #result()}. Integer input is
   * summed exactly in a long.
   */
  static final class Mean implements Accumulator {
    private final boolean integerInput;
    private long longSum;
    private double doubleSum;
    private long count;

    Mean(boolean integerInput) {
      this.integerInput = integerInput;
    }

    @Override
    public AggregateFunction function() {
      return AggregateFunction.MEAN;
    }

    @Override
    public void add(Object value) {
      if (integerInput) {
        longSum = addExact(longSum, ((Number) value).longValue(), AggregateFunction.MEAN);
      } else {
        doubleSum += ((Number) value).doubleValue();
      }
      count++;
    }

    @Override
    public void merge(Accumulator other) {
      Mean that = sameKind(this, other);
      if (that.integerInput != integerInput) {
        throw new IllegalStateException("Cannot merge integer and floating point mean states");
      }
      longSum = addExact(longSum, that.longSum, AggregateFunction.MEAN);
      doubleSum += that.doubleSum;
      count += that.count;
    }

    @Override
    public Object result() {
      if (count == 0) {
        return null;
      }
      if (integerInput) {
        return BigDecimal.valueOf(longSum)
            .divide(BigDecimal.valueOf(count), MathContext.DECIMAL128)
            .doubleValue();
      }
      return doubleSum / count;
    }
  }

  static final class Extreme implements Accumulator {
    private final AggregateFunction function;
    private Object value;

    Extreme(AggregateFunction function) {
      this.function = function;
    }

    @Override
    public AggregateFunction function() {
      return function;
    }

    @Override
    public void add(Object candidate) {
      if (value == null) {
        value = candidate;
        return;
      }
      int cmp = ColumnValues.compare(candidate, value);
      if (function == AggregateFunction.MIN ? cmp < 0 : cmp > 0) {
        value = candidate;
      }
    }

    @Override
    public void merge(Accumulator other) {
      Extreme that = sameKind(this, other);
      if (that.value != null) {
        add(that.value);
      }
    }

    @Override
    public Object result() {
      return value;
    }
  }
}
