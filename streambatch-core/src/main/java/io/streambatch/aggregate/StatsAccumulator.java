package io.streambatch.aggregate;

import io.streambatch.ConfigurationException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Online summary statistics of one numeric column plus a bounded reservoir sample for quantiles.
 *
 * <p>Count, sum, sum of squares, min and max are exact. Quantiles come from the reservoir, which
 * fills from the earliest batches: each batch contributes a random sample of at most {@code
 * perBatchCap} values until the reservoir is full, and nothing after that. Quantiles are therefore
 * approximate and biased toward the start of the data.
 */
public final class StatsAccumulator {
  private final int capacity;
  private final int perBatchCap;
  private final Random random;
  private final double[] reservoir;
  private int reservoirSize;
  private long count;
  private double sum;
  private double sumSq;
  private double min = Double.POSITIVE_INFINITY;
  private double max = Double.NEGATIVE_INFINITY;
  private long rowsScanned;
  private long missingValues;

  /**
   * @param capacity reservoir capacity
   * @param perBatchCap maximum values sampled from one batch
   * @param random sample generator
   */
  public StatsAccumulator(int capacity, int perBatchCap, Random random) {
    if (capacity <= 0 || perBatchCap <= 0) {
      throw new ConfigurationException(
          "Reservoir capacity and per-batch sample must be positive, got "
              + capacity
              + " and "
              + perBatchCap);
    }
    this.capacity = capacity;
    this.perBatchCap = perBatchCap;
    this.random = random;
    this.reservoir = new double[capacity];
  }

  /**
   * Folds one batch of values in.
   *
   * @param values non-missing values of the batch; only the first {@code n} entries are read
   * @param n number of values
   * @param scanned rows in the batch, including missing ones
   */
  public void addBatch(double[] values, int n, int scanned) {
    rowsScanned += scanned;
    missingValues += scanned - n;
    for (int i = 0; i < n; i++) {
      double x = values[i];
      sum += x;
      sumSq += x * x;
      if (x < min) {
        min = x;
      }
      if (x > max) {
        max = x;
      }
    }
    count += n;
    sample(values, n);
  }

  private void sample(double[] values, int n) {
    int remaining = capacity - reservoirSize;
    int take = Math.min(perBatchCap, Math.min(n, remaining));
    if (take <= 0) {
      return;
    }
    if (take == n) {
      System.arraycopy(values, 0, reservoir, reservoirSize, n);
      reservoirSize += n;
      return;
    }
    // partial Fisher-Yates over a copy of the indexes picks take distinct values
    int[] indexes = new int[n];
    for (int i = 0; i < n; i++) {
      indexes[i] = i;
    }
    for (int i = 0; i < take; i++) {
      int j = i + random.nextInt(n - i);
      int tmp = indexes[i];
      indexes[i] = indexes[j];
      indexes[j] = tmp;
      reservoir[reservoirSize++] = values[indexes[i]];
    }
  }

  public long count() {
    return count;
  }

  public long rowsScanned() {
    return rowsScanned;
  }

  public long missingValues() {
    return missingValues;
  }

  public int sampleSize() {
    return reservoirSize;
  }

  public double mean() {
    return count == 0 ? 0.0 : sum / count;
  }

  /** Population variance, clamped at zero against rounding. */
  public double variance() {
    if (count == 0) {
      return 0.0;
    }
    double mean = sum / count;
    return Math.max(0.0, sumSq / count - mean * mean);
  }

  public double stddev() {
    return Math.sqrt(variance());
  }

  /** Smallest value, or null with no values. */
  public Double min() {
    return count == 0 ? null : min;
  }

  /** Largest value, or null with no values. */
  public Double max() {
    return count == 0 ? null : max;
  }

  /**
   * Quantile of the sample by linear interpolation between closest ranks.
   *
   * @param q quantile in [0, 1]
   * @return the estimate, or null with an empty sample
   */
  public Double quantile(double q) {
    checkQuantile(q);
    if (reservoirSize == 0) {
      return null;
    }
    double[] sorted = Arrays.copyOf(reservoir, reservoirSize);
    Arrays.sort(sorted);
    return interpolate(sorted, q);
  }

  private static double interpolate(double[] sorted, double q) {
    double position = q * (sorted.length - 1);
    int lower = (int) Math.floor(position);
    int upper = (int) Math.ceil(position);
    double fraction = position - lower;
    return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
  }

  /**
   * Rejects quantiles outside [0, 1].
   *
   * @throws ConfigurationException for NaN or out-of-range values
   */
  public static void checkQuantile(double q) {
    if (!(q >= 0.0 && q <= 1.0)) {
      throw new ConfigurationException("Percentile must be within [0, 1], got " + q);
    }
  }

  /** Result key of a percentile: {@code p} followed by the rounded percentage. */
  public static String percentileKey(double q) {
    return "p" + Math.round(q * 100);
  }

  /**
   * Final summary with keys {@code count, mean, stddev, min, max, median} followed by one
   * {@code p<N>} entry per requested percentile.
   */
  public Map<String, Object> summary(List<Double> percentiles) {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("count", count);
    result.put("mean", mean());
    result.put("stddev", stddev());
    result.put("min", min());
    result.put("max", max());
    double[] sorted = Arrays.copyOf(reservoir, reservoirSize);
    Arrays.sort(sorted);
    result.put("median", sorted.length == 0 ? null : interpolate(sorted, 0.5));
    for (double q : percentiles) {
      checkQuantile(q);
      result.put(percentileKey(q), sorted.length == 0 ? null : interpolate(sorted, q));
    }
    return result;
  }
}
