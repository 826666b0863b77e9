package io.streambatch.source;

import io.streambatch.BatchReadException;
import io.streambatch.ConfigurationException;
import io.streambatch.DatasetNotFoundException;
import io.streambatch.RecordBatchReader;
import io.streambatch.config.DelimitedTextOptions;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.arrow.memory.BufferAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads datasets from files under a data directory.
 *
 * <p>Example:
 *
 * <pre>{@code
 * BatchSource source = new LocalBatchSource(dataDir, allocator, 100_000);
 * // reads lineitem.parquet, or lineitem.arrow when there is no Parquet file
 * try (RecordBatchReader reader = source.open("lineitem", List.of("quantity"), null)) {
 *   while (reader.loadNextBatch()) {
 *     VectorSchemaRoot batch = reader.getVectorSchemaRoot();
 *     // ...
 *   }
 * }
 * }</pre>
 */
public final class LocalBatchSource implements BatchSource {
  private static final Logger logger = LoggerFactory.getLogger(LocalBatchSource.class);

  private final Path dataDirectory;
  private final BufferAllocator allocator;
  private final int batchSize;
  private final DelimitedTextOptions textOptions;
  private final AtomicInteger openReaders = new AtomicInteger();

  /** Creates a source that parses text files with their format's default options. */
  public LocalBatchSource(Path dataDirectory, BufferAllocator allocator, int batchSize) {
    this(dataDirectory, allocator, batchSize, null);
  }

  /**
   * Creates a source.
   *
   * @param dataDirectory root that dataset names are resolved against
   * @param allocator parent allocator; each reader uses a child of it
   * @param batchSize maximum rows per batch
   * @param textOptions parsing options for every text dataset, or null for per-format defaults
   */
  public LocalBatchSource(
      Path dataDirectory,
      BufferAllocator allocator,
      int batchSize,
      DelimitedTextOptions textOptions) {
    if (batchSize <= 0) {
      throw new ConfigurationException("Batch size must be positive, got " + batchSize);
    }
    this.dataDirectory = dataDirectory;
    this.allocator = allocator;
    this.batchSize = batchSize;
    this.textOptions = textOptions;
  }

  public Path dataDirectory() {
    return dataDirectory;
  }

  @Override
  public RecordBatchReader open(String dataset, List<String> columns, String filterHints) {
    String name = null;
    Path path = null;
    List<String> tried = new ArrayList<>();
    for (String candidate : DataFormat.candidateNames(dataset)) {
      Path resolved = dataDirectory.resolve(candidate);
      if (Files.isRegularFile(resolved)) {
        name = candidate;
        path = resolved;
        break;
      }
      tried.add(resolved.toString());
    }
    if (path == null) {
      throw new DatasetNotFoundException(dataset, String.join(" or ", tried));
    }
    DataFormat format = DataFormat.detect(name);
    ReaderFactory factory =
        new ReaderFactory(name, allocator, batchSize, columns, filterHints, this::readerClosed);
    RecordBatchReader reader;
    try {
      switch (format) {
        case CSV:
        case TBL:
          DelimitedTextOptions options =
              textOptions != null ? textOptions : format.defaultTextOptions();
          InputStream in = Files.newInputStream(path);
          reader = factory.text(in, options);
          break;
        case PARQUET:
          reader = factory.parquet(Files.newByteChannel(path));
          break;
        default:
          reader = factory.arrow(Files.newByteChannel(path));
          break;
      }
    } catch (IOException e) {
      throw new BatchReadException(dataset, 0, e);
    }
    openReaders.incrementAndGet();
    logger.info("Reading {} ({}) in batches of up to {} rows", path, format, batchSize);
    return reader;
  }

  private void readerClosed() {
    openReaders.decrementAndGet();
  }

  @Override
  public int batchSize() {
    return batchSize;
  }

  @Override
  public int openReaders() {
    return openReaders.get();
  }

  @Override
  public String toString() {
    return "LocalBatchSource{" + dataDirectory + '}';
  }
}
