package io.streambatch;

import java.nio.file.Path;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * Output of a filter or projection: either one in-memory root or one Arrow IPC file, plus row
 * counts. Close it to release the in-memory root.
 */
public final class FilterResult implements AutoCloseable {
  private final ResultMode mode;
  private final VectorSchemaRoot root;
  private final Path file;
  private final long rowsScanned;
  private final long rowsMatched;
  private final int spillCount;

  private FilterResult(
      ResultMode mode,
      VectorSchemaRoot root,
      Path file,
      long rowsScanned,
      long rowsMatched,
      int spillCount) {
    this.mode = mode;
    this.root = root;
    this.file = file;
    this.rowsScanned = rowsScanned;
    this.rowsMatched = rowsMatched;
    this.spillCount = spillCount;
  }

  static FilterResult inMemory(VectorSchemaRoot root, long rowsScanned, long rowsMatched) {
    return new FilterResult(ResultMode.IN_MEMORY, root, null, rowsScanned, rowsMatched, 0);
  }

  static FilterResult file(Path file, long rowsScanned, long rowsMatched, int spillCount) {
    return new FilterResult(ResultMode.FILE, null, file, rowsScanned, rowsMatched, spillCount);
  }

  public ResultMode mode() {
    return mode;
  }

  /**
   * The matching rows.
   *
   * @throws IllegalStateException if the result was written to a file
   */
  public VectorSchemaRoot root() {
    if (root == null) {
      throw new IllegalStateException("Result was written to " + file);
    }
    return root;
  }

  /**
   * The Arrow IPC file holding the matching rows.
   *
   * @throws IllegalStateException if the result is in memory
   */
  public Path file() {
    if (file == null) {
      throw new IllegalStateException("Result is held in memory");
    }
    return file;
  }

  /** Rows read from the source. */
  public long rowsScanned() {
    return rowsScanned;
  }

  /** Rows in the result. */
  public long rowsMatched() {
    return rowsMatched;
  }

  /** Spill files written while collecting the result. Always 0 for in-memory results. */
  public int spillCount() {
    return spillCount;
  }

  @Override
  public void close() {
    if (root != null) {
      root.close();
    }
  }

  @Override
  public String toString() {
    return "FilterResult{mode="
        + mode
        + ", rowsScanned="
        + rowsScanned
        + ", rowsMatched="
        + rowsMatched
        + ", spillCount="
        + spillCount
        + (file != null ? ", file=" + file : "")
        + '}';
  }
}
