package io.streambatch;

import java.time.Duration;

/**
 * Resource usage of one operation as measured by a {@link TelemetrySink}.
 *
 * @param rowsProcessed rows the operation reported
 * @param duration wall-clock duration
 * @param avgCpuPercent mean CPU utilization
 * @param maxCpuPercent peak CPU utilization
 * @param avgMemoryMb mean resident memory
 * @param maxMemoryMb peak resident memory
 * @param diskReadMb bytes read from disk, in MB
 * @param diskWriteMb bytes written to disk, in MB
 */
public record OperationSummary(
    long rowsProcessed,
    Duration duration,
    double avgCpuPercent,
    double maxCpuPercent,
    double avgMemoryMb,
    double maxMemoryMb,
    double diskReadMb,
    double diskWriteMb) {

  /** A summary carrying only a row count and duration; every resource figure is zero. */
  public static OperationSummary of(long rowsProcessed, Duration duration) {
    return new OperationSummary(rowsProcessed, duration, 0, 0, 0, 0, 0, 0);
  }
}
