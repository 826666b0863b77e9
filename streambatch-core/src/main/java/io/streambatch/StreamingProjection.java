package io.streambatch;

import io.streambatch.config.ProcessingConfig;
import io.streambatch.source.BatchSource;
import java.nio.file.Path;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams selected columns of a dataset into one result, under the same spill policy as {@link
 * StreamingFilter}. A row limit turns it into a bounded preview that stops reading early.
 */
public final class StreamingProjection {
  private static final Logger logger = LoggerFactory.getLogger(StreamingProjection.class);

  private final ProcessingConfig config;
  private final BufferAllocator allocator;

  public StreamingProjection(ProcessingConfig config, BufferAllocator allocator) {
    this.config = config;
    this.allocator = allocator;
  }

  /** Selects columns without cancellation. */
  public FilterResult select(
      BatchSource source,
      String dataset,
      List<String> columns,
      ResultMode mode,
      Path output,
      long limit) {
    return select(source, dataset, columns, mode, output, limit, CancellationToken.NONE);
  }

  /**
   * Selects columns.
   *
   * @param columns columns in output order; must not be empty
   * @param limit maximum rows to return, or 0 for all
   * @throws ResourceExceededException in {@link ResultMode#IN_MEMORY} when anything spilled
   */
  public FilterResult select(
      BatchSource source,
      String dataset,
      List<String> columns,
      ResultMode mode,
      Path output,
      long limit,
      CancellationToken token) {
    if (columns == null || columns.isEmpty()) {
      throw new ConfigurationException("At least one column must be selected");
    }
    FilterResult result =
        StreamingFilter.collect(
            "select",
            config,
            allocator,
            source,
            dataset,
            null,
            columns,
            mode,
            output,
            limit,
            token);
    logger.info(
        "Selected {} columns of {}: {} rows, {} spills",
        columns.size(),
        dataset,
        result.rowsMatched(),
        result.spillCount());
    return result;
  }
}
