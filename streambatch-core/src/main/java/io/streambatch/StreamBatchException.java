package io.streambatch;

/**
 * Base exception class for streambatch errors.
 *
 * <p>This is the parent class for all exceptions thrown by sources, operators and the spill layer.
 * Every subclass is unchecked; callers that only care about "the operation failed" can catch this
 * type.
 */
public class StreamBatchException extends RuntimeException {
  public StreamBatchException(String message) {
    super(message);
  }

  public StreamBatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
