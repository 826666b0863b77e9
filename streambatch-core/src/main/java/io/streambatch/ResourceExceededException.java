package io.streambatch;

import io.streambatch.spill.SpillManifest;

/**
 * Raised when an in-memory result was requested but the operation had to spill.
 *
 * <p>The spilled rows are not lost: ownership of the spill files passes to the caller through
 * {@link #manifest()}, which can be read with {@link SpillManifest#openReader} and must be
 * removed with {@link SpillManifest#deleteAll()} once consumed.
 */
public class ResourceExceededException extends StreamBatchException {
  private final transient SpillManifest manifest;

  public ResourceExceededException(String operation, long ceilingBytes, SpillManifest manifest) {
    super(
        operation
            + " result exceeded the memory ceiling of "
            + ceilingBytes
            + " bytes; "
            + manifest.totalRows()
            + " rows spilled to "
            + manifest.size()
            + " files listed in "
            + manifest.manifestPath());
    this.manifest = manifest;
  }

  public SpillManifest manifest() {
    return manifest;
  }
}
