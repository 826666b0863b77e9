package io.streambatch.aggregate;

import io.streambatch.ConfigurationException;
import java.util.Locale;

/** Aggregate functions supported by the streaming aggregator. */
public enum AggregateFunction {
  SUM,
  COUNT,
  MEAN,
  MIN,
  MAX;

  /** Lowercase name used in output column names, e.g. {@code quantity_sum}. */
  public String functionName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Whether the function only accepts numeric input columns. */
  public boolean requiresNumeric() {
    return this == SUM || this == MEAN;
  }

  /**
   * Looks up a function by name, case-insensitively. {@code avg} is accepted for {@link #MEAN}.
   *
   * @throws ConfigurationException for an unknown name
   */
  public static AggregateFunction fromName(String name) {
    if (name == null) {
      throw new ConfigurationException("Aggregate function name is null");
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "sum":
        return SUM;
      case "count":
        return COUNT;
      case "mean":
      case "avg":
        return MEAN;
      case "min":
        return MIN;
      case "max":
        return MAX;
      default:
        throw new ConfigurationException(
            "Unknown aggregate function '"
                + name
                + "'; expected sum, count, mean, avg, min or max");
    }
  }
}
