package io.streambatch;

/** Raised at a batch boundary once the operation's {@link CancellationToken} was cancelled. */
public class OperationCancelledException extends StreamBatchException {
  public OperationCancelledException(String operation) {
    super("Operation cancelled: " + operation);
  }
}
