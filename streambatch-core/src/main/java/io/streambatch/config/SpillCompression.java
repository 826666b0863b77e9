package io.streambatch.config;

import java.util.Locale;
import org.apache.arrow.vector.compression.CompressionUtil;

/** Compression codec used for spilling intermediate results to disk. */
public enum SpillCompression {
  ZSTD(CompressionUtil.CodecType.ZSTD),
  LZ4_FRAME(CompressionUtil.CodecType.LZ4_FRAME),
  UNCOMPRESSED(CompressionUtil.CodecType.NO_COMPRESSION);

  private final CompressionUtil.CodecType codecType;

  SpillCompression(CompressionUtil.CodecType codecType) {
    this.codecType = codecType;
  }

  /** Returns the Arrow IPC body codec for this setting. */
  public CompressionUtil.CodecType codecType() {
    return codecType;
  }

  /** Returns the lowercase string value used in option maps. */
  String toConfigValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  static SpillCompression fromConfigValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
