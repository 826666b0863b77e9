package io.streambatch.spill;

import io.streambatch.StreamBatchException;
import io.streambatch.config.SpillCompression;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import org.apache.arrow.compression.CommonsCompressionFactory;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorLoader;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.VectorUnloader;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.ipc.ArrowFileReader;
import org.apache.arrow.vector.ipc.ArrowFileWriter;
import org.apache.arrow.vector.ipc.message.ArrowRecordBatch;
import org.apache.arrow.vector.ipc.message.IpcOption;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes batches to one Arrow IPC file with optional body compression.
 *
 * <p>Batches are copied into the writer's own root, so callers keep ownership of what they pass
 * in. {@link #finish()} completes the file; closing an unfinished writer deletes the partial
 * file.
 */
public final class SpillWriter implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(SpillWriter.class);

  private final Path path;
  private final BufferAllocator allocator;
  private final FileChannel channel;
  private final VectorSchemaRoot writerRoot;
  private final VectorLoader loader;
  private final ArrowFileWriter writer;
  private long rowCount;
  private boolean finished;
  private boolean closed;

  private SpillWriter(
      Path path,
      BufferAllocator allocator,
      FileChannel channel,
      VectorSchemaRoot writerRoot,
      ArrowFileWriter writer) {
    this.path = path;
    this.allocator = allocator;
    this.channel = channel;
    this.writerRoot = writerRoot;
    this.loader = new VectorLoader(writerRoot);
    this.writer = writer;
  }

  /**
   * Creates the file and writes the IPC header.
   *
   * @param path file to create; an existing file is replaced
   * @param schema schema of every batch
   * @param compression body codec
   * @param allocator parent allocator for the writer's buffers
   */
  public static SpillWriter create(
      Path path, Schema schema, SpillCompression compression, BufferAllocator allocator) {
    BufferAllocator child = allocator.newChildAllocator("spill-writer", 0, Long.MAX_VALUE);
    FileChannel channel = null;
    VectorSchemaRoot root = null;
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      channel =
          FileChannel.open(
              path,
              StandardOpenOption.CREATE,
              StandardOpenOption.TRUNCATE_EXISTING,
              StandardOpenOption.WRITE);
      root = VectorSchemaRoot.create(schema, child);
      ArrowFileWriter writer = newWriter(root, channel, compression);
      writer.start();
      return new SpillWriter(path, child, channel, root, writer);
    } catch (IOException | RuntimeException e) {
      if (root != null) {
        root.close();
      }
      closeQuietly(channel);
      child.close();
      throw new StreamBatchException("Failed to create spill file " + path, e);
    }
  }

  private static ArrowFileWriter newWriter(
      VectorSchemaRoot root, FileChannel channel, SpillCompression compression) {
    DictionaryProvider provider = new DictionaryProvider.MapDictionaryProvider();
    if (compression == SpillCompression.UNCOMPRESSED) {
      return new ArrowFileWriter(root, provider, channel);
    }
    return new ArrowFileWriter(
        root,
        provider,
        channel,
        Map.of(),
        IpcOption.DEFAULT,
        CommonsCompressionFactory.INSTANCE,
        compression.codecType());
  }

  public Path path() {
    return path;
  }

  /** Rows written so far. */
  public long rowCount() {
    return rowCount;
  }

  /** Appends one batch. Empty batches are skipped. */
  public void write(VectorSchemaRoot batch) {
    if (batch.getRowCount() == 0) {
      return;
    }
    VectorUnloader unloader = new VectorUnloader(batch);
    try (ArrowRecordBatch recordBatch = unloader.getRecordBatch()) {
      loader.load(recordBatch);
      writer.writeBatch();
      rowCount += batch.getRowCount();
    } catch (IOException e) {
      throw new StreamBatchException("Failed to write batch to " + path, e);
    } finally {
      writerRoot.clear();
    }
  }

  /** Appends every batch of another Arrow IPC file with the same schema. */
  public void writeAll(Path arrowFile) {
    try (BufferAllocator readAllocator =
            allocator.newChildAllocator("spill-copy", 0, Long.MAX_VALUE);
        SeekableByteChannel in = Files.newByteChannel(arrowFile);
        ArrowFileReader reader =
            new ArrowFileReader(in, readAllocator, CommonsCompressionFactory.INSTANCE)) {
      while (reader.loadNextBatch()) {
        write(reader.getVectorSchemaRoot());
      }
    } catch (IOException e) {
      throw new StreamBatchException("Failed to copy " + arrowFile + " into " + path, e);
    }
  }

  /**
   * Writes the IPC footer and closes the file.
   *
   * @return the finished file
   */
  public SpillFile finish() {
    try {
      writer.end();
      long size = channel.size();
      finished = true;
      close();
      logger.debug("Wrote {} rows ({} bytes) to {}", rowCount, size, path);
      return new SpillFile(path, rowCount, size);
    } catch (IOException e) {
      close();
      throw new StreamBatchException("Failed to finish spill file " + path, e);
    }
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      writer.close();
    } catch (RuntimeException e) {
      logger.error("Error closing writer for {}", path, e);
    }
    closeQuietly(channel);
    writerRoot.close();
    allocator.close();
    if (!finished) {
      try {
        Files.deleteIfExists(path);
      } catch (IOException e) {
        logger.error("Error deleting partial spill file {}", path, e);
      }
    }
  }

  private static void closeQuietly(FileChannel channel) {
    if (channel == null) {
      return;
    }
    try {
      channel.close();
    } catch (IOException e) {
      logger.error("Error closing channel", e);
    }
  }
}
