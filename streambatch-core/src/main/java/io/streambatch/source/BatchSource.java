package io.streambatch.source;

import io.streambatch.RecordBatchReader;
import java.util.List;

/**
 * A capability that opens datasets as lazy sequences of record batches.
 *
 * <p>Implementations differ only in where bytes come from; every source honors the same
 * contract:
 *
 * <ul>
 *   <li>every batch has between 1 and {@link #batchSize()} rows;
 *   <li>an unknown projected or filtered column fails at open time with {@link
 *       io.streambatch.ColumnNotFoundException};
 *   <li>a missing dataset fails with {@link io.streambatch.DatasetNotFoundException} and an
 *       unknown extension with {@link io.streambatch.FormatUnsupportedException}, both before any
 *       batch is read;
 *   <li>closing the reader, at any point, releases every file handle, stream and buffer it holds.
 * </ul>
 */
public interface BatchSource {

  /**
   * Opens a dataset.
   *
   * @param dataset dataset identifier: a file name relative to the source root or an object key
   * @param columns columns to read, in output order; null for all columns
   * @param filterHints optional filter expression (see {@link io.streambatch.Predicates#parse});
   *     rows that do not match are dropped before re-chunking
   * @return a reader positioned before the first batch
   */
  RecordBatchReader open(String dataset, List<String> columns, String filterHints);

  /** Opens a dataset with the given projection and no filter. */
  default RecordBatchReader open(String dataset, List<String> columns) {
    return open(dataset, columns, null);
  }

  /** Opens a dataset with every column and no filter. */
  default RecordBatchReader open(String dataset) {
    return open(dataset, null, null);
  }

  /** Maximum number of rows per produced batch. */
  int batchSize();

  /** Number of readers opened by this source and not yet closed. */
  int openReaders();
}
