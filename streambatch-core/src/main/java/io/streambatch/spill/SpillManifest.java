package io.streambatch.spill;

import io.streambatch.RecordBatchReader;
import io.streambatch.StreamBatchException;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import org.apache.arrow.memory.BufferAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered record of the spill files written by one operation.
 *
 * <p>The manifest is mirrored to a plain-text file next to the spills after every change, so an
 * interrupted run leaves a durable list of what it wrote. Each line holds one spill as
 * {@code path<TAB>rows<TAB>bytes}; lines starting with {@code #} are comments, one of which
 * records the pending-merge flag.
 *
 * <p>Not safe for concurrent writers.
 */
public final class SpillManifest {
  private static final Logger logger = LoggerFactory.getLogger(SpillManifest.class);

  private static final String PENDING_MERGE = "# pending_merge=";

  private final String operation;
  private final Path directory;
  private final Path manifestPath;
  private final String runId;
  private final List<SpillFile> files = new ArrayList<>();
  private boolean pendingMerge;

  private SpillManifest(String operation, Path directory, Path manifestPath, String runId) {
    this.operation = operation;
    this.directory = directory;
    this.manifestPath = manifestPath;
    this.runId = runId;
  }

  /**
   * Starts a new, empty manifest and writes its file.
   *
   * @param directory spill directory, created if missing
   * @param operation operation name used as the file name prefix
   */
  public static SpillManifest create(Path directory, String operation) {
    String runId = UUID.randomUUID().toString();
    Path manifestPath = directory.resolve(operation + "-" + runId + ".manifest");
    SpillManifest manifest = new SpillManifest(operation, directory, manifestPath, runId);
    manifest.persist();
    return manifest;
  }

  /**
   * Reads a manifest file written by a previous run.
   *
   * @throws StreamBatchException if the file cannot be read or is malformed
   */
  public static SpillManifest load(Path manifestPath) {
    String fileName = manifestPath.getFileName().toString();
    String stem =
        fileName.endsWith(".manifest")
            ? fileName.substring(0, fileName.length() - ".manifest".length())
            : fileName;
    // stem is <operation>-<uuid>; a UUID is 36 characters
    String operation = stem.length() > 37 ? stem.substring(0, stem.length() - 37) : stem;
    String runId = stem.length() > 37 ? stem.substring(stem.length() - 36) : stem;
    Path directory = manifestPath.toAbsolutePath().getParent();
    SpillManifest manifest = new SpillManifest(operation, directory, manifestPath, runId);
    try {
      for (String line : Files.readAllLines(manifestPath, StandardCharsets.UTF_8)) {
        if (line.isBlank()) {
          continue;
        }
        if (line.startsWith(PENDING_MERGE)) {
          manifest.pendingMerge =
              Boolean.parseBoolean(line.substring(PENDING_MERGE.length()).trim());
          continue;
        }
        if (line.startsWith("#")) {
          continue;
        }
        String[] parts = line.split("\t");
        if (parts.length != 3) {
          throw new StreamBatchException(
              "Malformed manifest line in " + manifestPath + ": " + line);
        }
        manifest.files.add(
            new SpillFile(Path.of(parts[0]), Long.parseLong(parts[1]), Long.parseLong(parts[2])));
      }
    } catch (IOException | NumberFormatException e) {
      throw new StreamBatchException("Failed to read spill manifest " + manifestPath, e);
    }
    return manifest;
  }

  public String operation() {
    return operation;
  }

  /** Location of the manifest file. */
  public Path manifestPath() {
    return manifestPath;
  }

  /** Spill files in the order they were written. */
  public List<SpillFile> files() {
    return Collections.unmodifiableList(files);
  }

  public int size() {
    return files.size();
  }

  public boolean isEmpty() {
    return files.isEmpty();
  }

  public long totalRows() {
    long rows = 0;
    for (SpillFile file : files) {
      rows += file.rowCount();
    }
    return rows;
  }

  public long totalBytes() {
    long bytes = 0;
    for (SpillFile file : files) {
      bytes += file.sizeBytes();
    }
    return bytes;
  }

  /** Whether spills exist that have not yet been merged into a final result. */
  public boolean pendingMerge() {
    return pendingMerge;
  }

  /** Path for the next spill file: {@code <operation>-spill-<n>-<uuid>.arrow}. */
  Path nextSpillPath() {
    return directory.resolve(operation + "-spill-" + files.size() + "-" + runId + ".arrow");
  }

  /** Records a finished spill file and updates the manifest file. */
  void add(SpillFile file) {
    files.add(file);
    pendingMerge = true;
    persist();
  }

  /** Records that every spill has been merged into the final result. */
  void markMerged() {
    pendingMerge = false;
    persist();
  }

  /**
   * Opens a reader over every spilled batch, file by file, in spill order.
   *
   * @param allocator parent allocator for the reader's buffers
   * @throws IllegalStateException if the manifest has no files
   */
  public RecordBatchReader openReader(BufferAllocator allocator) {
    if (files.isEmpty()) {
      throw new IllegalStateException("Spill manifest " + manifestPath + " has no files");
    }
    List<Path> paths = new ArrayList<>();
    for (SpillFile file : files) {
      paths.add(file.path());
    }
    return new SpillFileReader(operation + " spill", paths, allocator);
  }

  /** Deletes every spill file and the manifest file. Failures are logged. */
  public void deleteAll() {
    for (SpillFile file : files) {
      deleteQuietly(file.path());
    }
    files.clear();
    pendingMerge = false;
    deleteQuietly(manifestPath);
  }

  private void persist() {
    try {
      Files.createDirectories(directory);
      try (BufferedWriter out = Files.newBufferedWriter(manifestPath, StandardCharsets.UTF_8)) {
        out.write("# streambatch spill manifest for " + operation);
        out.newLine();
        out.write(PENDING_MERGE + pendingMerge);
        out.newLine();
        for (SpillFile file : files) {
          out.write(file.path() + "\t" + file.rowCount() + "\t" + file.sizeBytes());
          out.newLine();
        }
      }
    } catch (IOException e) {
      throw new StreamBatchException("Failed to write spill manifest " + manifestPath, e);
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      logger.error("Error deleting {}", path, e);
    }
  }

  @Override
  public String toString() {
    return "SpillManifest{"
        + "manifest="
        + manifestPath
        + ", files="
        + files.size()
        + ", rows="
        + totalRows()
        + ", pendingMerge="
        + pendingMerge
        + '}';
  }
}
