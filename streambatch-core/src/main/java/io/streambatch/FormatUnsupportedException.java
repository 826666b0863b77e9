package io.streambatch;

/** Raised before any batch is read when a dataset's encoding is not recognized. */
public class FormatUnsupportedException extends StreamBatchException {
  public FormatUnsupportedException(String message) {
    super(message);
  }

  public FormatUnsupportedException(String message, Throwable cause) {
    super(message, cause);
  }
}
