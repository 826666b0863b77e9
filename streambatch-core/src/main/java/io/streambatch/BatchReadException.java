package io.streambatch;

/**
 * An I/O failure while reading a batch. Carries the dataset and the index of the batch being
 * produced so the caller can retry the whole operation.
 */
public class BatchReadException extends StreamBatchException {
  private final String dataset;
  private final int batchIndex;

  public BatchReadException(String dataset, int batchIndex, Throwable cause) {
    super(
        "Failed to read batch " + batchIndex + " of " + dataset + ": " + cause.getMessage(),
        cause);
    this.dataset = dataset;
    this.batchIndex = batchIndex;
  }

  public String dataset() {
    return dataset;
  }

  /** Zero-based index of the batch that failed. */
  public int batchIndex() {
    return batchIndex;
  }
}
