package io.streambatch;

import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * Output of a grouped aggregation: one row per group in first-appearance order, group columns
 * first. Close it to release the root.
 */
public final class AggregationResult implements AutoCloseable {
  private final VectorSchemaRoot root;
  private final long rowsScanned;
  private final int batchCount;

  AggregationResult(VectorSchemaRoot root, long rowsScanned, int batchCount) {
    this.root = root;
    this.rowsScanned = rowsScanned;
    this.batchCount = batchCount;
  }

  public VectorSchemaRoot root() {
    return root;
  }

  public int groupCount() {
    return root.getRowCount();
  }

  public long rowsScanned() {
    return rowsScanned;
  }

  public int batchCount() {
    return batchCount;
  }

  @Override
  public void close() {
    root.close();
  }
}
