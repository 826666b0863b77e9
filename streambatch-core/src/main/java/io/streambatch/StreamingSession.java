package io.streambatch;

import io.streambatch.aggregate.AggregateSpec;
import io.streambatch.config.DelimitedTextOptions;
import io.streambatch.config.ProcessingConfig;
import io.streambatch.source.BatchSource;
import io.streambatch.source.LocalBatchSource;
import io.streambatch.source.ObjectStoreClient;
import io.streambatch.source.RemoteBatchSource;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;
import java.util.function.ToLongFunction;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point bundling a {@link ProcessingConfig}, an Arrow allocator and a {@link
 * TelemetrySink}.
 *
 * <p>The session creates sources bound to its allocator and batch size, and runs each operation
 * between one {@link TelemetrySink#start} and one {@link TelemetrySink#stop} call tagged {@value
 * #MODE_TAG}. Results allocated by an operation must be closed before the session.
 */
public class StreamingSession implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(StreamingSession.class);

  /** Mode tag passed to the telemetry sink. */
  public static final String MODE_TAG = "streaming";

  private final ProcessingConfig config;
  private final BufferAllocator allocator;
  private final BufferAllocator ownedRoot;
  private final TelemetrySink telemetry;
  private volatile OperationSummary lastSummary;
  private volatile boolean closed = false;

  /** Creates a session with its own root allocator and no telemetry. */
  public StreamingSession(ProcessingConfig config) {
    this(config, null, TelemetrySink.NOOP);
  }

  /**
   * Creates a session.
   *
   * @param config processing settings
   * @param parent allocator to take a child from, or null for a private root allocator
   * @param telemetry sink called around every operation
   */
  public StreamingSession(
      ProcessingConfig config, BufferAllocator parent, TelemetrySink telemetry) {
    this.config = config;
    this.telemetry = telemetry == null ? TelemetrySink.NOOP : telemetry;
    this.ownedRoot = parent == null ? new RootAllocator() : null;
    BufferAllocator base = parent != null ? parent : ownedRoot;
    this.allocator = base.newChildAllocator("streaming-session", 0, Long.MAX_VALUE);
    logger.debug("Created StreamingSession with {}", config);
  }

  public ProcessingConfig config() {
    return config;
  }

  /** Allocator used by this session's sources and results. */
  public BufferAllocator allocator() {
    return allocator;
  }

  /** Summary of the last operation that completed, or null before the first one. */
  public OperationSummary lastSummary() {
    return lastSummary;
  }

  /** A source reading files under {@code dataDirectory}. */
  public BatchSource localSource(Path dataDirectory) {
    return localSource(dataDirectory, null);
  }

  /** A source reading files under {@code dataDirectory} with explicit text parsing options. */
  public BatchSource localSource(Path dataDirectory, DelimitedTextOptions textOptions) {
    checkNotClosed();
    return new LocalBatchSource(dataDirectory, allocator, config.batchSize(), textOptions);
  }

  /** A source reading objects through {@code client}. */
  public BatchSource remoteSource(ObjectStoreClient client) {
    checkNotClosed();
    return new RemoteBatchSource(client, allocator, config.batchSize());
  }

  /** See {@link StreamingFilter#filter}. */
  public FilterResult filter(
      BatchSource source,
      String dataset,
      RowPredicate predicate,
      List<String> columns,
      ResultMode mode,
      Path output,
      CancellationToken token) {
    StreamingFilter filter = new StreamingFilter(config, allocator);
    return run(
        "filter",
        dataset,
        () -> filter.filter(source, dataset, predicate, columns, mode, output, token),
        FilterResult::rowsScanned);
  }

  /** Filters with a textual expression such as {@code "quantity > 30 AND flag = 'R'"}. */
  public FilterResult filter(
      BatchSource source,
      String dataset,
      String expression,
      List<String> columns,
      ResultMode mode) {
    RowPredicate predicate = Predicates.parse(expression);
    return filter(source, dataset, predicate, columns, mode, null, CancellationToken.NONE);
  }

  /** See {@link StreamingProjection#select}. */
  public FilterResult select(
      BatchSource source,
      String dataset,
      List<String> columns,
      ResultMode mode,
      Path output,
      long limit,
      CancellationToken token) {
    StreamingProjection projection = new StreamingProjection(config, allocator);
    return run(
        "select",
        dataset,
        () -> projection.select(source, dataset, columns, mode, output, limit, token),
        FilterResult::rowsScanned);
  }

  /** See {@link StreamingAggregator#aggregate}. */
  public AggregationResult aggregate(
      BatchSource source,
      String dataset,
      List<String> groupBy,
      List<AggregateSpec> aggregates,
      CancellationToken token) {
    StreamingAggregator aggregator = new StreamingAggregator(config, allocator);
    return run(
        "aggregate",
        dataset,
        () -> aggregator.aggregate(source, dataset, groupBy, aggregates, token),
        AggregationResult::rowsScanned);
  }

  /** Aggregates without cancellation. */
  public AggregationResult aggregate(
      BatchSource source, String dataset, List<String> groupBy, List<AggregateSpec> aggregates) {
    return aggregate(source, dataset, groupBy, aggregates, CancellationToken.NONE);
  }

  /** See {@link StreamingStatistics#compute}. */
  public StatisticsResult statistics(
      BatchSource source,
      String dataset,
      String column,
      List<Double> percentiles,
      CancellationToken token) {
    StreamingStatistics statistics = new StreamingStatistics(config);
    return run(
        "statistics",
        dataset,
        () -> statistics.compute(source, dataset, column, percentiles, token),
        StatisticsResult::rowsScanned);
  }

  /** Computes statistics without cancellation. */
  public StatisticsResult statistics(
      BatchSource source, String dataset, String column, List<Double> percentiles) {
    return statistics(source, dataset, column, percentiles, CancellationToken.NONE);
  }

  private <T> T run(
      String operation, String dataset, Supplier<T> body, ToLongFunction<T> rowsProcessed) {
    checkNotClosed();
    telemetry.start(operation, dataset, MODE_TAG);
    T result;
    try {
      result = body.get();
    } catch (RuntimeException e) {
      lastSummary = telemetry.stop(0);
      logger.debug("{} of {} failed after {}", operation, dataset, lastSummary.duration());
      throw e;
    }
    lastSummary = telemetry.stop(rowsProcessed.applyAsLong(result));
    logger.debug("{} of {} finished: {}", operation, dataset, lastSummary);
    return result;
  }

  private void checkNotClosed() {
    if (closed) {
      throw new IllegalStateException("StreamingSession has been closed");
    }
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      allocator.close();
    } catch (IllegalStateException e) {
      logger.error("Closing StreamingSession with unreleased buffers", e);
    }
    if (ownedRoot != null) {
      try {
        ownedRoot.close();
      } catch (IllegalStateException e) {
        logger.error("Error closing root allocator", e);
      }
    }
    logger.debug("Closed StreamingSession");
  }
}
