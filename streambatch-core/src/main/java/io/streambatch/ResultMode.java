package io.streambatch;

/** Where a filter or projection delivers its rows. */
public enum ResultMode {
  /** One in-memory root. Fails with {@link ResourceExceededException} if anything spilled. */
  IN_MEMORY,
  /** One Arrow IPC file combining every spill and the in-memory remainder. */
  FILE
}
