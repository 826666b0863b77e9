package io.streambatch;

import java.time.Duration;

/**
 * Receives operation boundaries from a {@link StreamingSession}. Implementations sample CPU,
 * memory and disk counters between {@link #start} and {@link #stop}; the session calls each
 * exactly once per operation, never per batch.
 */
public interface TelemetrySink {

  /** A sink that measures nothing. */
  TelemetrySink NOOP =
      new TelemetrySink() {
        @Override
        public void start(String operation, String dataset, String modeTag) {}

        @Override
        public OperationSummary stop(long rowsProcessed) {
          return OperationSummary.of(rowsProcessed, Duration.ZERO);
        }
      };

  /**
   * Marks the start of an operation.
   *
   * @param operation operation name, e.g. {@code filter}
   * @param dataset dataset identifier
   * @param modeTag processing mode; always {@code streaming} for this library
   */
  void start(String operation, String dataset, String modeTag);

  /**
   * Marks the end of the operation started last.
   *
   * @param rowsProcessed rows reported by the operation, 0 if it failed
   * @return the measured summary
   */
  OperationSummary stop(long rowsProcessed);
}
