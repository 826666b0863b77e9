package io.streambatch.aggregate;

import io.streambatch.ConfigurationException;
import java.util.Objects;

/**
 * One output column of an aggregation: a function applied to a source column.
 *
 * @param column source column
 * @param function aggregate function
 * @param alias output column name, or null for {@code <column>_<function>}
 */
public record AggregateSpec(String column, AggregateFunction function, String alias) {

  public AggregateSpec {
    Objects.requireNonNull(function, "function");
    if (column == null || column.isEmpty()) {
      throw new ConfigurationException("Aggregate column name is empty");
    }
  }

  /** Creates a spec from a function name such as {@code "sum"} or {@code "avg"}. */
  public static AggregateSpec of(String column, String function) {
    return new AggregateSpec(column, AggregateFunction.fromName(function), null);
  }

  public static AggregateSpec of(String column, AggregateFunction function) {
    return new AggregateSpec(column, function, null);
  }

  /** Returns a copy with an explicit output name. */
  public AggregateSpec as(String name) {
    return new AggregateSpec(column, function, name);
  }

  /** Output column name. */
  public String outputName() {
    return alias != null ? alias : column + "_" + function.functionName();
  }
}
