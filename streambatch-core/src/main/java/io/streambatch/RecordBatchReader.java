package io.streambatch;

import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * A lazy, finite, forward-only sequence of record batches.
 *
 * <p>The pattern follows Arrow's ArrowReader approach: call {@link #getVectorSchemaRoot()} once to
 * get the schema and buffer container, then call {@link #loadNextBatch()} to populate it with each
 * batch of data. A reader cannot be restarted; open a new one instead.
 *
 * <p>Readers hold file channels, network streams and Arrow buffers. Always use them in a
 * try-with-resources block; closing before the end of the data is allowed and releases
 * everything.
 */
public interface RecordBatchReader extends AutoCloseable {
  /**
   * Returns the schema of every batch this reader produces. Available before the first batch.
   *
   * @return the (possibly projected) schema
   */
  Schema getSchema();

  /**
   * Gets the VectorSchemaRoot that will be populated with data as batches are loaded.
   *
   * <p>The returned VectorSchemaRoot is reused across batches. Each call to {@link
   * #loadNextBatch()} replaces its contents, so data that must outlive the current batch has to be
   * copied.
   *
   * @return The VectorSchemaRoot containing the schema and current batch data
   */
  VectorSchemaRoot getVectorSchemaRoot();

  /**
   * Loads the next batch of data into the VectorSchemaRoot.
   *
   * @return true if a non-empty batch was loaded, false if no more batches are available
   * @throws BatchReadException if the underlying storage fails
   */
  boolean loadNextBatch();

  /** Number of batches loaded so far. */
  int batchCount();

  /**
   * Releases resources held by this reader.
   *
   * <p>After calling close, the reader should not be used. Calling close more than once has no
   * effect.
   */
  @Override
  void close();
}
