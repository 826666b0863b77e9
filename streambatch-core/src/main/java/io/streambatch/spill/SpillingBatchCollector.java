package io.streambatch.spill;

import io.streambatch.Batches;
import io.streambatch.ResourceExceededException;
import io.streambatch.config.SpillCompression;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates owned batches under a {@link MemoryGovernor}, spilling them to compressed Arrow IPC
 * files whenever the accumulated size goes over the ceiling.
 *
 * <p>A collector is finished exactly once, either in memory or to a file. Closing it releases
 * every batch it still holds and deletes its spill files, unless they were handed to the caller
 * through a {@link ResourceExceededException}.
 */
public final class SpillingBatchCollector implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(SpillingBatchCollector.class);

  private final String operation;
  private final Schema schema;
  private final MemoryGovernor governor;
  private final Path spillDirectory;
  private final SpillCompression compression;
  private final BufferAllocator allocator;
  private final List<VectorSchemaRoot> batches = new ArrayList<>();
  private long accumulatedBytes;
  private long rowCount;
  private SpillManifest manifest;
  private boolean handedOff;
  private boolean closed;

  /**
   * @param operation name used for spill file names and log messages
   * @param schema schema of every batch added
   * @param governor spill policy
   * @param spillDirectory where spill files go
   * @param compression spill body codec
   * @param allocator allocator used for the combined in-memory result and spill writers
   */
  public SpillingBatchCollector(
      String operation,
      Schema schema,
      MemoryGovernor governor,
      Path spillDirectory,
      SpillCompression compression,
      BufferAllocator allocator) {
    this.operation = operation;
    this.schema = schema;
    this.governor = governor;
    this.spillDirectory = spillDirectory;
    this.compression = compression;
    this.allocator = allocator;
  }

  /**
   * Takes ownership of a batch. Spills everything held if the total goes over the ceiling.
   *
   * @param batch a batch with this collector's schema; closed by the collector
   */
  public void add(VectorSchemaRoot batch) {
    if (closed) {
      batch.close();
      throw new IllegalStateException("Collector for " + operation + " is closed");
    }
    if (batch.getRowCount() == 0) {
      batch.close();
      return;
    }
    batches.add(batch);
    rowCount += batch.getRowCount();
    accumulatedBytes += MemoryGovernor.estimateBytes(batch);
    if (governor.shouldSpill(accumulatedBytes)) {
      spill();
    }
  }

  /** Rows added so far, spilled or not. */
  public long rowCount() {
    return rowCount;
  }

  /** Number of spill files written so far. */
  public int spillCount() {
    return manifest == null ? 0 : manifest.size();
  }

  /** Estimated bytes currently held in memory. */
  public long accumulatedBytes() {
    return accumulatedBytes;
  }

  private void spill() {
    if (batches.isEmpty()) {
      return;
    }
    if (manifest == null) {
      manifest = SpillManifest.create(spillDirectory, operation);
    }
    SpillFile file;
    try (SpillWriter writer =
        SpillWriter.create(manifest.nextSpillPath(), schema, compression, allocator)) {
      for (VectorSchemaRoot batch : batches) {
        writer.write(batch);
      }
      file = writer.finish();
    }
    manifest.add(file);
    logger.info(
        "{}: spilled {} rows (~{} bytes in memory, {} bytes on disk) to {}",
        operation,
        file.rowCount(),
        accumulatedBytes,
        file.sizeBytes(),
        file.path());
    releaseBatches();
  }

  private void releaseBatches() {
    for (VectorSchemaRoot batch : batches) {
      batch.close();
    }
    batches.clear();
    accumulatedBytes = 0;
  }

  /**
   * Returns every collected row as one root owned by the caller.
   *
   * @throws ResourceExceededException if anything was spilled; the remainder is spilled too and
   *     the manifest is handed to the caller
   */
  public VectorSchemaRoot finishInMemory() {
    if (manifest != null) {
      spill();
      handedOff = true;
      throw new ResourceExceededException(operation, governor.ceilingBytes(), manifest);
    }
    VectorSchemaRoot result = Batches.concat(schema, batches, allocator);
    releaseBatches();
    return result;
  }

  /**
   * Writes every collected row, spilled ones first, into one Arrow IPC file and deletes the
   * spills.
   *
   * @param output target file, or null for a generated name in the spill directory
   * @return the written file
   */
  public SpillFile finishToFile(Path output) {
    Path target =
        output != null
            ? output
            : spillDirectory.resolve(operation + "-result-" + UUID.randomUUID() + ".arrow");
    SpillFile result;
    try (SpillWriter writer = SpillWriter.create(target, schema, compression, allocator)) {
      if (manifest != null) {
        for (SpillFile file : manifest.files()) {
          writer.writeAll(file.path());
        }
      }
      for (VectorSchemaRoot batch : batches) {
        writer.write(batch);
      }
      result = writer.finish();
    }
    releaseBatches();
    if (manifest != null) {
      manifest.markMerged();
      manifest.deleteAll();
    }
    logger.info("{}: wrote {} rows to {}", operation, result.rowCount(), target);
    return result;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    releaseBatches();
    if (manifest != null && !handedOff) {
      manifest.deleteAll();
    }
  }
}
