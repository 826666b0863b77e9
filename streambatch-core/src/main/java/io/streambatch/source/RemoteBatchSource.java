package io.streambatch.source;

import io.streambatch.BatchReadException;
import io.streambatch.ConfigurationException;
import io.streambatch.DatasetNotFoundException;
import io.streambatch.RecordBatchReader;
import io.streambatch.config.DelimitedTextOptions;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.arrow.memory.BufferAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads datasets from a remote object store through an explicit {@link ObjectStoreClient}.
 *
 * <p>Arrow IPC and Parquet objects are read through a seekable channel, text objects through a
 * stream. The
 * client is not owned by the source and is never closed by it.
 */
public final class RemoteBatchSource implements BatchSource {
  private static final Logger logger = LoggerFactory.getLogger(RemoteBatchSource.class);

  private final ObjectStoreClient client;
  private final BufferAllocator allocator;
  private final int batchSize;
  private final DelimitedTextOptions textOptions;
  private final AtomicInteger openReaders = new AtomicInteger();

  public RemoteBatchSource(ObjectStoreClient client, BufferAllocator allocator, int batchSize) {
    this(client, allocator, batchSize, null);
  }

  /**
   * @param client object store client
   * @param allocator parent allocator; each reader uses a child of it
   * @param batchSize maximum rows per batch
   * @param textOptions parsing options for every text object, or null for per-format defaults
   */
  public RemoteBatchSource(
      ObjectStoreClient client,
      BufferAllocator allocator,
      int batchSize,
      DelimitedTextOptions textOptions) {
    if (batchSize <= 0) {
      throw new ConfigurationException("Batch size must be positive, got " + batchSize);
    }
    this.client = Objects.requireNonNull(client, "client");
    this.allocator = allocator;
    this.batchSize = batchSize;
    this.textOptions = textOptions;
  }

  @Override
  public RecordBatchReader open(String dataset, List<String> columns, String filterHints) {
    String key = null;
    long size;
    try {
      for (String candidate : DataFormat.candidateNames(dataset)) {
        if (client.exists(candidate)) {
          key = candidate;
          break;
        }
      }
      if (key == null) {
        throw new DatasetNotFoundException(
            dataset, "object key " + String.join(" or ", DataFormat.candidateNames(dataset)));
      }
      size = client.size(key);
    } catch (IOException e) {
      throw new BatchReadException(dataset, 0, e);
    }
    DataFormat format = DataFormat.detect(key);
    ReaderFactory factory =
        new ReaderFactory(key, allocator, batchSize, columns, filterHints, this::readerClosed);
    RecordBatchReader reader;
    try {
      switch (format) {
        case CSV:
        case TBL:
          DelimitedTextOptions options =
              textOptions != null ? textOptions : format.defaultTextOptions();
          reader = factory.text(client.openStream(key), options);
          break;
        case PARQUET:
          reader = factory.parquet(client.openChannel(key));
          break;
        default:
          reader = factory.arrow(client.openChannel(key));
          break;
      }
    } catch (IOException e) {
      throw new BatchReadException(dataset, 0, e);
    }
    openReaders.incrementAndGet();
    logger.info(
        "Streaming remote object {} ({}, {} bytes) in batches of up to {} rows",
        key,
        format,
        size,
        batchSize);
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
}
