package io.streambatch.source;

import io.streambatch.Predicates;
import io.streambatch.RecordBatchReader;
import io.streambatch.RowPredicate;
import io.streambatch.config.DelimitedTextOptions;
import java.io.InputStream;
import java.nio.channels.SeekableByteChannel;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;

/** Builds format readers for one open call; shared by the local and remote sources. */
final class ReaderFactory {
  private final String dataset;
  private final BufferAllocator allocator;
  private final int batchSize;
  private final List<String> columns;
  private final RowPredicate filter;
  private final Runnable onClose;

  /**
   * @throws io.streambatch.ConfigurationException if {@code filterHints} does not parse
   */
  ReaderFactory(
      String dataset,
      BufferAllocator allocator,
      int batchSize,
      List<String> columns,
      String filterHints,
      Runnable onClose) {
    this.dataset = dataset;
    this.allocator = allocator;
    this.batchSize = batchSize;
    this.columns = columns == null ? null : List.copyOf(columns);
    this.filter =
        filterHints == null || filterHints.isBlank() ? null : Predicates.parse(filterHints);
    this.onClose = onClose;
  }

  RecordBatchReader arrow(SeekableByteChannel channel) {
    return new ArrowIpcBatchReader(
        dataset, channel, allocator, batchSize, columns, filter, onClose);
  }

  RecordBatchReader parquet(SeekableByteChannel channel) {
    return new ParquetBatchReader(
        dataset, channel, allocator, batchSize, columns, filter, onClose);
  }

  RecordBatchReader text(InputStream in, DelimitedTextOptions options) {
    return new DelimitedTextBatchReader(
        dataset, in, options, allocator, batchSize, columns, filter, onClose);
  }
}
