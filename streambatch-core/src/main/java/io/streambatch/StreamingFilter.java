package io.streambatch;

import io.streambatch.config.ProcessingConfig;
import io.streambatch.source.BatchSource;
import io.streambatch.spill.MemoryGovernor;
import io.streambatch.spill.SpillFile;
import io.streambatch.spill.SpillingBatchCollector;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams a dataset through a row predicate and collects the matching rows.
 *
 * <p>Matches are copied out of each batch and held until their estimated size goes over the
 * memory ceiling, at which point they are spilled to a compressed Arrow IPC file. Which rows match
 * never depends on the ceiling; only where they end up does.
 */
public final class StreamingFilter {
  private static final Logger logger = LoggerFactory.getLogger(StreamingFilter.class);

  private final ProcessingConfig config;
  private final BufferAllocator allocator;

  /**
   * @param config ceiling, spill directory and compression
   * @param allocator allocator for collected batches and the result
   */
  public StreamingFilter(ProcessingConfig config, BufferAllocator allocator) {
    this.config = config;
    this.allocator = allocator;
  }

  /** Filters without cancellation. */
  public FilterResult filter(
      BatchSource source,
      String dataset,
      RowPredicate predicate,
      List<String> columns,
      ResultMode mode,
      Path output) {
    return filter(source, dataset, predicate, columns, mode, output, CancellationToken.NONE);
  }

  /**
   * Filters a dataset.
   *
   * @param source where to read from
   * @param dataset dataset identifier
   * @param predicate row condition
   * @param columns output columns, or null for all
   * @param mode in-memory result or file
   * @param output target file for {@link ResultMode#FILE}, or null for a generated name
   * @param token checked once per batch
   * @return the matching rows
   * @throws ResourceExceededException in {@link ResultMode#IN_MEMORY} when anything spilled
   */
  public FilterResult filter(
      BatchSource source,
      String dataset,
      RowPredicate predicate,
      List<String> columns,
      ResultMode mode,
      Path output,
      CancellationToken token) {
    if (predicate == null) {
      throw new ConfigurationException("Filter predicate is required");
    }
    FilterResult result =
        collect(
            "filter",
            config,
            allocator,
            source,
            dataset,
            predicate,
            columns,
            mode,
            output,
            0,
            token);
    logger.info(
        "Filtered {}: {} of {} rows matched, {} spills",
        dataset,
        result.rowsMatched(),
        result.rowsScanned(),
        result.spillCount());
    return result;
  }

  /**
   * Shared scan loop of the filter and the projection.
   *
   * @param predicate row condition, or null to keep every row
   * @param limit maximum rows to collect; 0 for no limit
   */
  static FilterResult collect(
      String operation,
      ProcessingConfig config,
      BufferAllocator allocator,
      BatchSource source,
      String dataset,
      RowPredicate predicate,
      List<String> columns,
      ResultMode mode,
      Path output,
      long limit,
      CancellationToken token) {
    if (mode == null) {
      throw new ConfigurationException("Result mode is required");
    }
    if (limit < 0) {
      throw new ConfigurationException("Row limit must not be negative, got " + limit);
    }
    MemoryGovernor governor = MemoryGovernor.ofMegabytes(config.maxMemoryMb());
    List<String> readColumns = readColumns(columns, predicate);
    long rowsScanned = 0;
    try (RecordBatchReader reader = source.open(dataset, readColumns, null)) {
      Schema outputSchema = outputSchema(reader.getSchema(), columns);
      try (SpillingBatchCollector collector =
          new SpillingBatchCollector(
              operation,
              outputSchema,
              governor,
              config.spillDirectory(),
              config.spillCompression(),
              allocator)) {
        int[] rows = new int[0];
        while (limit == 0 || collector.rowCount() < limit) {
          token.throwIfCancelled(operation);
          if (!reader.loadNextBatch()) {
            break;
          }
          VectorSchemaRoot batch = reader.getVectorSchemaRoot();
          int n = batch.getRowCount();
          rowsScanned += n;
          if (rows.length < n) {
            rows = new int[n];
          }
          int count = 0;
          for (int row = 0; row < n; row++) {
            if (predicate == null || predicate.test(batch, row)) {
              rows[count++] = row;
            }
          }
          if (limit > 0) {
            count = (int) Math.min(count, limit - collector.rowCount());
          }
          if (count > 0) {
            List<FieldVector> from = vectors(batch, outputSchema);
            collector.add(Batches.copySelected(outputSchema, from, rows, count, allocator));
          }
        }
        long matched = collector.rowCount();
        if (mode == ResultMode.IN_MEMORY) {
          return FilterResult.inMemory(collector.finishInMemory(), rowsScanned, matched);
        }
        int spills = collector.spillCount();
        SpillFile file = collector.finishToFile(output);
        return FilterResult.file(file.path(), rowsScanned, matched, spills);
      }
    }
  }

  private static List<String> readColumns(List<String> columns, RowPredicate predicate) {
    if (columns == null) {
      return null;
    }
    LinkedHashSet<String> read = new LinkedHashSet<>(columns);
    if (predicate != null) {
      read.addAll(predicate.columns());
    }
    return new ArrayList<>(read);
  }

  private static Schema outputSchema(Schema readSchema, List<String> columns) {
    if (columns == null) {
      return readSchema;
    }
    List<Field> fields = new ArrayList<>(columns.size());
    for (String column : columns) {
      fields.add(readSchema.findField(column));
    }
    return new Schema(fields);
  }

  private static List<FieldVector> vectors(VectorSchemaRoot batch, Schema outputSchema) {
    List<FieldVector> vectors = new ArrayList<>(outputSchema.getFields().size());
    for (Field field : outputSchema.getFields()) {
      vectors.add(batch.getVector(field.getName()));
    }
    return vectors;
  }
}
