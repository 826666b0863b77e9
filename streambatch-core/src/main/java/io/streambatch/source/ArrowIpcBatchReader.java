package io.streambatch.source;

import io.streambatch.FormatUnsupportedException;
import io.streambatch.RowPredicate;
import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.util.List;
import org.apache.arrow.compression.CommonsCompressionFactory;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowFileReader;
import org.apache.arrow.vector.ipc.InvalidArrowFileException;
import org.apache.arrow.vector.ipc.message.ArrowBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an Arrow IPC file one record batch (row group) at a time. LZ4 and ZSTD compressed bodies
 * are decompressed transparently.
 */
final class ArrowIpcBatchReader extends ProjectingBatchReader {
  private static final Logger logger = LoggerFactory.getLogger(ArrowIpcBatchReader.class);

  private final SeekableByteChannel channel;
  private final ArrowFileReader reader;
  private final List<ArrowBlock> blocks;
  private int nextBlock;

  /**
   * Opens the file and reads its footer. The channel is owned by the reader from here on and
   * closed even if opening fails.
   */
  ArrowIpcBatchReader(
      String dataset,
      SeekableByteChannel channel,
      BufferAllocator parent,
      int batchSize,
      List<String> columns,
      RowPredicate filter,
      Runnable onClose) {
    super(
        dataset,
        parent.newChildAllocator("arrow-ipc:" + dataset, 0, Long.MAX_VALUE),
        batchSize,
        onClose);
    this.channel = channel;
    ArrowFileReader opened = null;
    try {
      opened = new ArrowFileReader(channel, allocator, CommonsCompressionFactory.INSTANCE);
      this.blocks = opened.getRecordBlocks();
      this.reader = opened;
      bind(opened.getVectorSchemaRoot().getSchema(), columns, filter);
    } catch (IOException | InvalidArrowFileException e) {
      release(opened);
      throw new FormatUnsupportedException("Not a readable Arrow IPC file: " + dataset, e);
    } catch (RuntimeException e) {
      release(opened);
      throw e;
    }
    logger.debug("Opened {} with {} record batches", dataset, blocks.size());
  }

  private void release(ArrowFileReader opened) {
    if (opened != null) {
      try {
        opened.close();
      } catch (IOException e) {
        logger.error("Error closing reader for {}", dataset, e);
      }
    }
    try {
      channel.close();
    } catch (IOException e) {
      logger.error("Error closing channel for {}", dataset, e);
    }
    allocator.close();
  }

  @Override
  protected VectorSchemaRoot nextInput() throws IOException {
    while (nextBlock < blocks.size()) {
      ArrowBlock block = blocks.get(nextBlock++);
      if (!reader.loadRecordBatch(block)) {
        return null;
      }
      VectorSchemaRoot root = reader.getVectorSchemaRoot();
      if (root.getRowCount() > 0) {
        return root;
      }
    }
    return null;
  }

  @Override
  protected void closeInput() {
    try {
      reader.close();
    } catch (IOException e) {
      logger.error("Error closing reader for {}", dataset, e);
    }
    try {
      channel.close();
    } catch (IOException e) {
      logger.error("Error closing channel for {}", dataset, e);
    }
  }
}
