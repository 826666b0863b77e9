package io.streambatch;

/**
 * Raised for invalid settings: unknown aggregation functions, non-positive memory ceilings or
 * batch sizes, malformed filter hints and similar. Validated eagerly, before any batch is read.
 */
public class ConfigurationException extends StreamBatchException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
