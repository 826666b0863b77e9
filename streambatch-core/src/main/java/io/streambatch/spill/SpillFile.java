package io.streambatch.spill;

import java.nio.file.Path;

/**
 * One Arrow IPC file written by a spill.
 *
 * @param path location of the file
 * @param rowCount rows written
 * @param sizeBytes size on disk
 */
public record SpillFile(Path path, long rowCount, long sizeBytes) {}
