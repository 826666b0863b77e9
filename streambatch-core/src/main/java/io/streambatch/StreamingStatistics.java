package io.streambatch;

import io.streambatch.aggregate.StatsAccumulator;
import io.streambatch.config.ProcessingConfig;
import io.streambatch.source.BatchSource;
import java.util.List;
import java.util.Random;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Summary statistics of one column in a single pass.
 *
 * <p>Count, mean, standard deviation (population), min and max are exact. The median and any
 * requested percentiles are estimated from a bounded reservoir sample that fills from the first
 * batches, see {@link StatsAccumulator}. Null values and text that does not parse as a number are
 * counted as missing and otherwise ignored.
 */
public final class StreamingStatistics {
  private static final Logger logger = LoggerFactory.getLogger(StreamingStatistics.class);

  private final ProcessingConfig config;

  public StreamingStatistics(ProcessingConfig config) {
    this.config = config;
  }

  /** Computes statistics without cancellation. */
  public StatisticsResult compute(
      BatchSource source, String dataset, String column, List<Double> percentiles) {
    return compute(source, dataset, column, percentiles, CancellationToken.NONE);
  }

  /**
   * Computes statistics of a column.
   *
   * @param percentiles extra quantiles in [0, 1] reported as {@code p<N>}; may be empty
   * @throws ConfigurationException if a percentile is outside [0, 1]
   */
  public StatisticsResult compute(
      BatchSource source,
      String dataset,
      String column,
      List<Double> percentiles,
      CancellationToken token) {
    List<Double> requested = percentiles == null ? List.of() : List.copyOf(percentiles);
    for (double q : requested) {
      StatsAccumulator.checkQuantile(q);
    }
    Random random =
        config.sampleSeed() != null ? new Random(config.sampleSeed()) : new Random();
    StatsAccumulator stats =
        new StatsAccumulator(config.reservoirCapacity(), config.samplePerBatch(), random);

    try (RecordBatchReader reader = source.open(dataset, List.of(column), null)) {
      double[] values = new double[0];
      while (true) {
        token.throwIfCancelled("statistics");
        if (!reader.loadNextBatch()) {
          break;
        }
        VectorSchemaRoot batch = reader.getVectorSchemaRoot();
        FieldVector vector = batch.getVector(column);
        int rows = batch.getRowCount();
        if (values.length < rows) {
          values = new double[rows];
        }
        int n = 0;
        for (int row = 0; row < rows; row++) {
          Double value = ColumnValues.readDouble(vector, row);
          if (value != null && !value.isNaN()) {
            values[n++] = value;
          }
        }
        stats.addBatch(values, n, rows);
      }
      logger.info(
          "Computed statistics of {}.{}: {} values, {} missing, sample of {}",
          dataset,
          column,
          stats.count(),
          stats.missingValues(),
          stats.sampleSize());
    }
    return new StatisticsResult(
        column,
        stats.summary(requested),
        stats.rowsScanned(),
        stats.missingValues(),
        stats.sampleSize());
  }
}
