package io.streambatch.source;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.SeekableByteChannel;

/**
 * Minimal client for a remote object store, addressed by object key.
 *
 * <p>Implementations wrap a vendor SDK (S3 or compatible). Failures surface as {@link
 * IOException}; the core does not retry them. Every channel and stream handed out is closed by
 * the reader that requested it.
 */
public interface ObjectStoreClient {

  /** Whether an object exists under {@code key}. */
  boolean exists(String key) throws IOException;

  /** Size of the object in bytes. */
  long size(String key) throws IOException;

  /**
   * Opens a seekable channel over the object. Used for columnar formats, which read the footer
   * before the data.
   */
  SeekableByteChannel openChannel(String key) throws IOException;

  /** Opens a sequential stream over the object. Used for delimited text. */
  InputStream openStream(String key) throws IOException;
}
