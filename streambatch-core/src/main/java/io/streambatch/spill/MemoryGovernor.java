package io.streambatch.spill;

import io.streambatch.Batches;
import io.streambatch.ConfigurationException;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * Soft memory ceiling for one operation.
 *
 * <p>The governor holds no state besides the ceiling; callers track how many bytes they have
 * accumulated and ask whether that amount calls for a spill.
 */
public final class MemoryGovernor {
  private static final long BYTES_PER_MB = 1024L * 1024L;

  private final long ceilingBytes;

  private MemoryGovernor(long ceilingBytes) {
    this.ceilingBytes = ceilingBytes;
  }

  /**
   * Creates a governor with a ceiling in megabytes.
   *
   * @throws ConfigurationException if {@code megabytes} is not positive
   */
  public static MemoryGovernor ofMegabytes(long megabytes) {
    if (megabytes <= 0) {
      throw new ConfigurationException("Memory ceiling must be positive, got " + megabytes + " MB");
    }
    return new MemoryGovernor(megabytes * BYTES_PER_MB);
  }

  /**
   * Creates a governor with a ceiling in bytes.
   *
   * @throws ConfigurationException if {@code bytes} is not positive
   */
  public static MemoryGovernor ofBytes(long bytes) {
    if (bytes <= 0) {
      throw new ConfigurationException("Memory ceiling must be positive, got " + bytes + " bytes");
    }
    return new MemoryGovernor(bytes);
  }

  public long ceilingBytes() {
    return ceilingBytes;
  }

  /** Whether {@code accumulatedBytes} is strictly above the ceiling. */
  public boolean shouldSpill(long accumulatedBytes) {
    return accumulatedBytes > ceilingBytes;
  }

  /** Whether {@code bytes} stays within the ceiling. */
  public boolean fits(long bytes) {
    return !shouldSpill(bytes);
  }

  /** Size estimate used for spill decisions: the sum of the batch's Arrow buffer sizes. */
  public static long estimateBytes(VectorSchemaRoot batch) {
    return Batches.estimateBytes(batch);
  }

  @Override
  public String toString() {
    return "MemoryGovernor{ceilingBytes=" + ceilingBytes + '}';
  }
}
