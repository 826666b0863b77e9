package io.streambatch.spill;

import io.streambatch.BatchReadException;
import io.streambatch.RecordBatchReader;
import io.streambatch.StreamBatchException;
import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.arrow.compression.CommonsCompressionFactory;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorLoader;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.VectorUnloader;
import org.apache.arrow.vector.ipc.ArrowFileReader;
import org.apache.arrow.vector.ipc.message.ArrowRecordBatch;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads the batches of several Arrow IPC files with one schema, one file after another. */
final class SpillFileReader implements RecordBatchReader {
  private static final Logger logger = LoggerFactory.getLogger(SpillFileReader.class);

  private final String name;
  private final List<Path> paths;
  private final BufferAllocator allocator;
  private final VectorSchemaRoot root;
  private final VectorLoader loader;
  private ArrowFileReader current;
  private SeekableByteChannel currentChannel;
  private int fileIndex;
  private int batchCount;
  private boolean closed;

  SpillFileReader(String name, List<Path> paths, BufferAllocator parent) {
    this.name = name;
    this.paths = List.copyOf(paths);
    this.allocator = parent.newChildAllocator(name, 0, Long.MAX_VALUE);
    try {
      openFile(0);
      Schema schema = current.getVectorSchemaRoot().getSchema();
      this.root = VectorSchemaRoot.create(schema, allocator);
      this.loader = new VectorLoader(root);
    } catch (IOException | RuntimeException e) {
      closeCurrent();
      allocator.close();
      throw new StreamBatchException("Failed to open " + paths.get(0), e);
    }
  }

  private void openFile(int index) throws IOException {
    fileIndex = index;
    currentChannel = Files.newByteChannel(paths.get(index));
    current = new ArrowFileReader(currentChannel, allocator, CommonsCompressionFactory.INSTANCE);
  }

  @Override
  public Schema getSchema() {
    return root.getSchema();
  }

  @Override
  public VectorSchemaRoot getVectorSchemaRoot() {
    return root;
  }

  @Override
  public boolean loadNextBatch() {
    if (closed) {
      return false;
    }
    try {
      while (true) {
        if (current == null) {
          return false;
        }
        if (current.loadNextBatch()) {
          VectorSchemaRoot source = current.getVectorSchemaRoot();
          if (source.getRowCount() == 0) {
            continue;
          }
          VectorUnloader unloader = new VectorUnloader(source);
          try (ArrowRecordBatch recordBatch = unloader.getRecordBatch()) {
            loader.load(recordBatch);
          }
          batchCount++;
          return true;
        }
        closeCurrent();
        if (fileIndex + 1 >= paths.size()) {
          return false;
        }
        openFile(fileIndex + 1);
      }
    } catch (IOException e) {
      throw new BatchReadException(name, batchCount, e);
    }
  }

  @Override
  public int batchCount() {
    return batchCount;
  }

  private void closeCurrent() {
    if (current != null) {
      try {
        current.close();
      } catch (IOException e) {
        logger.error("Error closing spill file {}", paths.get(fileIndex), e);
      }
      current = null;
    }
    if (currentChannel != null) {
      try {
        currentChannel.close();
      } catch (IOException e) {
        logger.error("Error closing channel for {}", paths.get(fileIndex), e);
      }
      currentChannel = null;
    }
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    root.close();
    closeCurrent();
    allocator.close();
    logger.debug("Closed reader over {} spill files", paths.size());
  }
}
