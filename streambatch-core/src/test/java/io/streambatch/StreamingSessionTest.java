package io.streambatch;

import static io.streambatch.TestData.batch;
import static io.streambatch.TestData.row;
import static org.junit.jupiter.api.Assertions.*;

import io.streambatch.aggregate.AggregateSpec;
import io.streambatch.config.ProcessingConfig;
import io.streambatch.source.BatchSource;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class StreamingSessionTest {

  @TempDir Path tempDir;

  private ProcessingConfig config;

  /** Records every start and stop call. */
  static final class RecordingSink implements TelemetrySink {
    final List<String> events = new ArrayList<>();

    @Override
    public void start(String operation, String dataset, String modeTag) {
      events.add("start " + operation + " " + dataset + " " + modeTag);
    }

    @Override
    public OperationSummary stop(long rowsProcessed) {
      events.add("stop " + rowsProcessed);
      return OperationSummary.of(rowsProcessed, Duration.ofMillis(1));
    }
  }

  @BeforeEach
  void setUp() throws IOException {
    config =
        ProcessingConfig.builder()
            .batchSize(2)
            .spillDirectory(tempDir.resolve("spill"))
            .sampleSeed(7L)
            .build();
    try (BufferAllocator allocator = new RootAllocator()) {
      TestData.writeArrow(
          tempDir.resolve("lineitem.arrow"),
          allocator,
          TestData.schema(TestData.int64("quantity"), TestData.utf8("flag")),
          List.of(batch(row(10L, "R"), row(40L, "R"), row(25L, "N"), row(60L, "R"))));
    }
  }

  @Test
  void testEveryOperationIsMeasuredOnce() {
    RecordingSink sink = new RecordingSink();
    try (BufferAllocator root = new RootAllocator();
        StreamingSession session = new StreamingSession(config, root, sink)) {
      BatchSource source = session.localSource(tempDir);
      assertEquals(2, source.batchSize());

      try (FilterResult result =
          session.filter(
              source, "lineitem", "quantity > 30 and flag = 'R'", null, ResultMode.IN_MEMORY)) {
        assertEquals(List.of(40L, 60L), TestData.column(result.root(), "quantity"));
      }
      assertEquals(4, session.lastSummary().rowsProcessed());

      try (AggregationResult result =
          session.aggregate(
              source, "lineitem", List.of("flag"), List.of(AggregateSpec.of("quantity", "sum")))) {
        assertEquals(2, result.groupCount());
      }

      StatisticsResult stats = session.statistics(source, "lineitem", "quantity", List.of());
      assertEquals(33.75, stats.mean(), 1e-12);

      assertEquals(
          List.of(
              "start filter lineitem streaming",
              "stop 4",
              "start aggregate lineitem streaming",
              "stop 4",
              "start statistics lineitem streaming",
              "stop 4"),
          sink.events);
    }
  }

  @Test
  void testFailedOperationStillStopsTelemetry() {
    RecordingSink sink = new RecordingSink();
    try (StreamingSession session = new StreamingSession(config, null, sink)) {
      BatchSource source = session.localSource(tempDir);

      assertThrows(
          DatasetNotFoundException.class,
          () ->
              session.select(
                  source,
                  "missing",
                  List.of("quantity"),
                  ResultMode.IN_MEMORY,
                  null,
                  0,
                  CancellationToken.NONE));

      assertEquals(List.of("start select missing streaming", "stop 0"), sink.events);
      assertEquals(0, session.lastSummary().rowsProcessed());
    }
  }

  @Test
  void testClosedSessionRejectsWork() {
    StreamingSession session = new StreamingSession(config);
    session.close();
    session.close();

    assertThrows(IllegalStateException.class, () -> session.localSource(tempDir));
  }

  @Test
  void testCancelledTokenFailsBeforeTheFirstBatch() {
    try (StreamingSession session = new StreamingSession(config)) {
      BatchSource source = session.localSource(tempDir);
      CancellationToken token = new CancellationToken();
      token.cancel();

      assertThrows(
          OperationCancelledException.class,
          () -> session.statistics(source, "lineitem", "quantity", List.of(), token));
      assertEquals(0, source.openReaders());
      assertEquals(0, session.allocator().getAllocatedMemory());
    }
  }
}
