package io.streambatch;

/** Raised when a dataset or a column does not exist. Never retried. */
public class NotFoundException extends StreamBatchException {
  public NotFoundException(String message) {
    super(message);
  }
}
