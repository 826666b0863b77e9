package io.streambatch.config;

import io.streambatch.ConfigurationException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for streaming operations.
 *
 * <p>Supports two modes of configuration, which can be combined:
 *
 * <ul>
 *   <li><b>Typed builder</b> -- {@link #builder()} with one method per setting.
 *   <li><b>Raw string map</b> -- {@link #fromStringMap(Map)} with dotted keys such as {@code
 *       "streambatch.processing.batch_size"}.
 * </ul>
 *
 * <p>Every value is validated by {@link Builder#build()}; an invalid value raises {@link
 * ConfigurationException} before any data is read.
 *
 * <p>Example:
 *
 * <pre>{@code
 * ProcessingConfig config = ProcessingConfig.builder()
 *     .batchSize(50_000)
 *     .maxMemoryMb(512)
 *     .spillCompression(SpillCompression.ZSTD)
 *     .build();
 *
 * try (StreamingSession session = new StreamingSession(config)) {
 *     ...
 * }
 * }</pre>
 */
public final class ProcessingConfig {

  public static final String BATCH_SIZE = "streambatch.processing.batch_size";
  public static final String MAX_MEMORY_MB = "streambatch.processing.max_memory_mb";
  public static final String SPILL_DIRECTORY = "streambatch.spill.directory";
  public static final String SPILL_COMPRESSION = "streambatch.spill.compression";
  public static final String RESERVOIR_CAPACITY = "streambatch.statistics.reservoir_capacity";
  public static final String SAMPLE_PER_BATCH = "streambatch.statistics.sample_per_batch";
  public static final String SAMPLE_SEED = "streambatch.statistics.sample_seed";

  static final int DEFAULT_BATCH_SIZE = 100_000;
  static final long DEFAULT_MAX_MEMORY_MB = 2048;
  static final int DEFAULT_RESERVOIR_CAPACITY = 10_000;
  static final int DEFAULT_SAMPLE_PER_BATCH = 1_000;

  private final int batchSize;
  private final long maxMemoryMb;
  private final Path spillDirectory;
  private final SpillCompression spillCompression;
  private final int reservoirCapacity;
  private final int samplePerBatch;
  private final Long sampleSeed;

  private ProcessingConfig(Builder builder) {
    this.batchSize = builder.batchSize;
    this.maxMemoryMb = builder.maxMemoryMb;
    this.spillDirectory = builder.spillDirectory;
    this.spillCompression = builder.spillCompression;
    this.reservoirCapacity = builder.reservoirCapacity;
    this.samplePerBatch = builder.samplePerBatch;
    this.sampleSeed = builder.sampleSeed;
  }

  /** Returns the default configuration. */
  public static ProcessingConfig defaults() {
    return new Builder().build();
  }

  /** Returns a builder for creating custom configurations. */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a ProcessingConfig from a raw string map. Unknown keys are rejected so that typos do
   * not silently fall back to defaults.
   *
   * @param options dotted-key options
   * @return a new ProcessingConfig
   * @throws ConfigurationException if a key is unknown or a value is invalid
   */
  public static ProcessingConfig fromStringMap(Map<String, String> options) {
    Builder builder = new Builder();
    for (Map.Entry<String, String> entry : options.entrySet()) {
      builder.option(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  /** Number of rows per produced batch. */
  public int batchSize() {
    return batchSize;
  }

  /** Soft memory ceiling in megabytes for accumulated results. */
  public long maxMemoryMb() {
    return maxMemoryMb;
  }

  /** Directory where spill files, manifests and generated result files are written. */
  public Path spillDirectory() {
    return spillDirectory;
  }

  public SpillCompression spillCompression() {
    return spillCompression;
  }

  /** Upper bound on the number of values kept for approximate quantiles. */
  public int reservoirCapacity() {
    return reservoirCapacity;
  }

  /** Upper bound on the number of values sampled from a single batch. */
  public int samplePerBatch() {
    return samplePerBatch;
  }

  /** Seed for the quantile sampler, or null for a time-based seed. */
  public Long sampleSeed() {
    return sampleSeed;
  }

  /**
   * Serializes all settings into a flat {@code Map<String, String>} with dotted keys. The result
   * can be passed back to {@link #fromStringMap(Map)}.
   *
   * @return the serialized options map
   */
  public Map<String, String> toOptionsMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(BATCH_SIZE, Integer.toString(batchSize));
    map.put(MAX_MEMORY_MB, Long.toString(maxMemoryMb));
    map.put(SPILL_DIRECTORY, spillDirectory.toString());
    map.put(SPILL_COMPRESSION, spillCompression.toConfigValue());
    map.put(RESERVOIR_CAPACITY, Integer.toString(reservoirCapacity));
    map.put(SAMPLE_PER_BATCH, Integer.toString(samplePerBatch));
    if (sampleSeed != null) {
      map.put(SAMPLE_SEED, sampleSeed.toString());
    }
    return map;
  }

  /** Returns a builder pre-populated with this configuration's values. */
  public Builder toBuilder() {
    Builder builder =
        new Builder()
            .batchSize(batchSize)
            .maxMemoryMb(maxMemoryMb)
            .spillDirectory(spillDirectory)
            .spillCompression(spillCompression)
            .reservoirCapacity(reservoirCapacity)
            .samplePerBatch(samplePerBatch);
    builder.sampleSeed = sampleSeed;
    return builder;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ProcessingConfig)) {
      return false;
    }
    return toOptionsMap().equals(((ProcessingConfig) o).toOptionsMap());
  }

  @Override
  public int hashCode() {
    return Objects.hash(toOptionsMap());
  }

  @Override
  public String toString() {
    return "ProcessingConfig" + toOptionsMap();
  }

  /** Builder for {@link ProcessingConfig}. */
  public static final class Builder {
    private int batchSize = DEFAULT_BATCH_SIZE;
    private long maxMemoryMb = DEFAULT_MAX_MEMORY_MB;
    private Path spillDirectory = Paths.get(System.getProperty("java.io.tmpdir"), "streambatch");
    private SpillCompression spillCompression = SpillCompression.LZ4_FRAME;
    private int reservoirCapacity = DEFAULT_RESERVOIR_CAPACITY;
    private int samplePerBatch = DEFAULT_SAMPLE_PER_BATCH;
    private Long sampleSeed;

    private Builder() {}

    /** Number of rows per produced batch. Default is 100,000. */
    public Builder batchSize(int value) {
      this.batchSize = value;
      return this;
    }

    /** Soft memory ceiling in megabytes. Default is 2048. */
    public Builder maxMemoryMb(long value) {
      this.maxMemoryMb = value;
      return this;
    }

    /** Directory for spill files. Default is {@code ${java.io.tmpdir}/streambatch}. */
    public Builder spillDirectory(Path value) {
      this.spillDirectory = value;
      return this;
    }

    /** Compression codec for spill files. Default is LZ4 frame. */
    public Builder spillCompression(SpillCompression value) {
      this.spillCompression = value;
      return this;
    }

    /** Maximum number of values kept for quantile estimation. Default is 10,000. */
    public Builder reservoirCapacity(int value) {
      this.reservoirCapacity = value;
      return this;
    }

    /** Maximum number of values sampled from one batch. Default is 1,000. */
    public Builder samplePerBatch(int value) {
      this.samplePerBatch = value;
      return this;
    }

    /** Fixes the quantile sampler's seed for reproducible results. */
    public Builder sampleSeed(long value) {
      this.sampleSeed = value;
      return this;
    }

    /**
     * Sets a single option by its dotted key.
     *
     * @param key one of the {@code ProcessingConfig} key constants
     * @param value the string value
     * @return this builder
     * @throws ConfigurationException if the key is unknown or the value cannot be parsed
     */
    public Builder option(String key, String value) {
      try {
        switch (key) {
          case BATCH_SIZE:
            return batchSize(Integer.parseInt(value.trim()));
          case MAX_MEMORY_MB:
            return maxMemoryMb(Long.parseLong(value.trim()));
          case SPILL_DIRECTORY:
            return spillDirectory(Paths.get(value.trim()));
          case SPILL_COMPRESSION:
            return spillCompression(SpillCompression.fromConfigValue(value));
          case RESERVOIR_CAPACITY:
            return reservoirCapacity(Integer.parseInt(value.trim()));
          case SAMPLE_PER_BATCH:
            return samplePerBatch(Integer.parseInt(value.trim()));
          case SAMPLE_SEED:
            return sampleSeed(Long.parseLong(value.trim()));
          default:
            throw new ConfigurationException("Unknown option: " + key);
        }
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("Invalid value for " + key + ": '" + value + "'", e);
      }
    }

    /**
     * Builds the {@link ProcessingConfig}.
     *
     * @throws ConfigurationException if any value is out of range
     */
    public ProcessingConfig build() {
      if (batchSize <= 0) {
        throw new ConfigurationException("batch_size must be positive, got " + batchSize);
      }
      if (maxMemoryMb <= 0) {
        throw new ConfigurationException("max_memory_mb must be positive, got " + maxMemoryMb);
      }
      if (spillDirectory == null) {
        throw new ConfigurationException("spill directory is required");
      }
      if (spillCompression == null) {
        throw new ConfigurationException("spill compression is required");
      }
      if (reservoirCapacity <= 0) {
        throw new ConfigurationException(
            "reservoir_capacity must be positive, got " + reservoirCapacity);
      }
      if (samplePerBatch <= 0) {
        throw new ConfigurationException(
            "sample_per_batch must be positive, got " + samplePerBatch);
      }
      return new ProcessingConfig(this);
    }
  }
}
