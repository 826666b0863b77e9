package io.streambatch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between the caller and a running operation.
 *
 * <p>Operations check the token once per batch, so cancellation takes effect at the next batch
 * boundary, not in the middle of one.
 */
public final class CancellationToken {

  /** A token that is never cancelled. */
  public static final CancellationToken NONE = new CancellationToken();

  private final AtomicBoolean cancelled = new AtomicBoolean();

  /** Requests cancellation. May be called from any thread. */
  public void cancel() {
    if (this == NONE) {
      throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
    }
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Throws if cancellation was requested.
   *
   * @param operation name used in the exception message
   * @throws OperationCancelledException if {@link #cancel()} was called
   */
  public void throwIfCancelled(String operation) {
    if (cancelled.get()) {
      throw new OperationCancelledException(operation);
    }
  }
}
