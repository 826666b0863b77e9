package io.streambatch;

import io.streambatch.aggregate.StatsAccumulator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Summary statistics of one column. Quantiles are estimated from a bounded sample. */
public final class StatisticsResult {
  private final String column;
  private final Map<String, Object> values;
  private final long rowsScanned;
  private final long missingValues;
  private final int sampleSize;

  StatisticsResult(
      String column,
      Map<String, Object> values,
      long rowsScanned,
      long missingValues,
      int sampleSize) {
    this.column = column;
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    this.rowsScanned = rowsScanned;
    this.missingValues = missingValues;
    this.sampleSize = sampleSize;
  }

  public String column() {
    return column;
  }

  public long count() {
    return (Long) values.get("count");
  }

  public double mean() {
    return (Double) values.get("mean");
  }

  public double stddev() {
    return (Double) values.get("stddev");
  }

  /** Smallest value, or null when the column had no values. */
  public Double min() {
    return (Double) values.get("min");
  }

  /** Largest value, or null when the column had no values. */
  public Double max() {
    return (Double) values.get("max");
  }

  /** Estimated median, or null when the column had no values. */
  public Double median() {
    return (Double) values.get("median");
  }

  /**
   * Estimated percentile requested at compute time.
   *
   * @param q the quantile in [0, 1] that was requested
   * @return the estimate, or null when the column had no values
   * @throws IllegalArgumentException if {@code q} was not requested
   */
  public Double percentile(double q) {
    String key = StatsAccumulator.percentileKey(q);
    if (!values.containsKey(key)) {
      throw new IllegalArgumentException("Percentile " + q + " was not requested");
    }
    return (Double) values.get(key);
  }

  /** Rows read, including those with a missing value. */
  public long rowsScanned() {
    return rowsScanned;
  }

  /** Rows whose value was null or not a number. */
  public long missingValues() {
    return missingValues;
  }

  /** Number of values in the quantile sample. */
  public int sampleSize() {
    return sampleSize;
  }

  /** Keys {@code count, mean, stddev, min, max, median} and one {@code p<N>} per percentile. */
  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public String toString() {
    return "StatisticsResult{column=" + column + ", " + values + '}';
  }
}
