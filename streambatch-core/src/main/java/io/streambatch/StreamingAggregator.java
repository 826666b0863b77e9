package io.streambatch;

import io.streambatch.aggregate.Accumulator;
import io.streambatch.aggregate.AggregateFunction;
import io.streambatch.aggregate.AggregateSpec;
import io.streambatch.aggregate.AggregatorState;
import io.streambatch.aggregate.GroupKey;
import io.streambatch.config.ProcessingConfig;
import io.streambatch.source.BatchSource;
import io.streambatch.spill.MemoryGovernor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grouped aggregation over a stream of batches.
 *
 * <p>Each batch is first aggregated on its own into partial accumulators, which are then merged
 * into the running group table: sums and counts add, minimums and maximums take the smaller or
 * larger value, and means merge their (sum, count) pairs and divide only at the end. Memory grows
 * with the number of distinct groups, not with the number of rows.
 *
 * <p>Null values are skipped by every function, so {@code count} counts non-null values. Rows
 * whose group value is null form their own group.
 */
public final class StreamingAggregator {
  private static final Logger logger = LoggerFactory.getLogger(StreamingAggregator.class);

  private final ProcessingConfig config;
  private final BufferAllocator allocator;

  public StreamingAggregator(ProcessingConfig config, BufferAllocator allocator) {
    this.config = config;
    this.allocator = allocator;
  }

  /** Aggregates without cancellation. */
  public AggregationResult aggregate(
      BatchSource source, String dataset, List<String> groupBy, List<AggregateSpec> aggregates) {
    return aggregate(source, dataset, groupBy, aggregates, CancellationToken.NONE);
  }

  /**
   * Aggregates a dataset.
   *
   * @param groupBy grouping columns; empty for one global group
   * @param aggregates output aggregates; at least one
   * @return one row per group, group columns first
   * @throws ConfigurationException if {@code aggregates} is empty or sum/mean targets a
   *     non-numeric column
   */
  public AggregationResult aggregate(
      BatchSource source,
      String dataset,
      List<String> groupBy,
      List<AggregateSpec> aggregates,
      CancellationToken token) {
    if (aggregates == null || aggregates.isEmpty()) {
      throw new ConfigurationException("At least one aggregate is required");
    }
    List<String> groupColumns = groupBy == null ? List.of() : List.copyOf(groupBy);
    MemoryGovernor governor = MemoryGovernor.ofMegabytes(config.maxMemoryMb());

    LinkedHashSet<String> read = new LinkedHashSet<>(groupColumns);
    for (AggregateSpec spec : aggregates) {
      read.add(spec.column());
    }

    try (RecordBatchReader reader = source.open(dataset, new ArrayList<>(read), null)) {
      Schema schema = reader.getSchema();
      boolean[] integerInputs = new boolean[aggregates.size()];
      List<Field> aggregateFields = new ArrayList<>(aggregates.size());
      for (int i = 0; i < aggregates.size(); i++) {
        AggregateSpec spec = aggregates.get(i);
        Field input = schema.findField(spec.column());
        if (spec.function().requiresNumeric() && !ColumnValues.isNumeric(input)) {
          throw new ConfigurationException(
              spec.function().functionName()
                  + " requires a numeric column but "
                  + spec.column()
                  + " is "
                  + input.getType());
        }
        integerInputs[i] = ColumnValues.isInteger(input);
        aggregateFields.add(outputField(spec, input));
      }
      List<Field> groupFields = new ArrayList<>(groupColumns.size());
      for (String column : groupColumns) {
        groupFields.add(ColumnValues.normalizedField(column, schema.findField(column)));
      }

      AggregatorState state = new AggregatorState(aggregates, integerInputs);
      long rowsScanned = 0;
      boolean warned = false;
      while (true) {
        token.throwIfCancelled("aggregate");
        if (!reader.loadNextBatch()) {
          break;
        }
        VectorSchemaRoot batch = reader.getVectorSchemaRoot();
        rowsScanned += batch.getRowCount();
        state.merge(aggregateBatch(batch, groupColumns, aggregates, state));
        if (!warned && governor.shouldSpill(state.estimatedBytes())) {
          warned = true;
          logger.warn(
              "Group table for {} holds {} groups (~{} bytes), above the {} byte ceiling",
              dataset,
              state.groupCount(),
              state.estimatedBytes(),
              governor.ceilingBytes());
        }
      }
      VectorSchemaRoot root = state.toRoot(groupFields, aggregateFields, allocator);
      logger.info(
          "Aggregated {}: {} rows in {} batches into {} groups",
          dataset,
          rowsScanned,
          reader.batchCount(),
          state.groupCount());
      return new AggregationResult(root, rowsScanned, reader.batchCount());
    }
  }

  /** Local group-by of one batch into fresh accumulators. */
  private static Map<GroupKey, Accumulator[]> aggregateBatch(
      VectorSchemaRoot batch,
      List<String> groupColumns,
      List<AggregateSpec> aggregates,
      AggregatorState state) {
    FieldVector[] keyVectors = new FieldVector[groupColumns.size()];
    for (int k = 0; k < keyVectors.length; k++) {
      keyVectors[k] = batch.getVector(groupColumns.get(k));
    }
    FieldVector[] valueVectors = new FieldVector[aggregates.size()];
    for (int a = 0; a < valueVectors.length; a++) {
      valueVectors[a] = batch.getVector(aggregates.get(a).column());
    }
    Map<GroupKey, Accumulator[]> partial = new LinkedHashMap<>();
    int rows = batch.getRowCount();
    Object[] keyValues = new Object[keyVectors.length];
    for (int row = 0; row < rows; row++) {
      for (int k = 0; k < keyVectors.length; k++) {
        Object key = ColumnValues.read(keyVectors[k], row);
        keyValues[k] = ColumnValues.isMissing(key) ? null : key;
      }
      Accumulator[] accumulators =
          partial.computeIfAbsent(new GroupKey(keyValues), key -> state.newAccumulators());
      for (int a = 0; a < valueVectors.length; a++) {
        Object value = ColumnValues.read(valueVectors[a], row);
        if (!ColumnValues.isMissing(value)) {
          accumulators[a].add(value);
        }
      }
    }
    return partial;
  }

  private static Field outputField(AggregateSpec spec, Field input) {
    String name = spec.outputName();
    AggregateFunction function = spec.function();
    switch (function) {
      case COUNT:
        return ColumnValues.int64(name);
      case SUM:
        return ColumnValues.isInteger(input)
            ? ColumnValues.int64(name)
            : ColumnValues.float64(name);
      case MEAN:
        return ColumnValues.float64(name);
      default:
        return ColumnValues.normalizedField(name, input);
    }
  }
}
