package io.streambatch;

import static io.streambatch.TestData.batch;
import static io.streambatch.TestData.row;
import static org.junit.jupiter.api.Assertions.*;

import io.streambatch.config.ProcessingConfig;
import io.streambatch.source.BatchSource;
import io.streambatch.source.LocalBatchSource;
import io.streambatch.spill.SpillManifest;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class StreamingFilterTest {

  private static final int ROWS_PER_BATCH = 10_000;
  private static final int BATCHES = 20;

  @TempDir Path tempDir;

  private ProcessingConfig config(long maxMemoryMb) {
    return ProcessingConfig.builder()
        .batchSize(ROWS_PER_BATCH)
        .maxMemoryMb(maxMemoryMb)
        .spillDirectory(tempDir.resolve("spill"))
        .build();
  }

  /** 200,000 rows of (id, quantity = id % 100, price = id / 4.0). */
  private Path writeLarge(BufferAllocator allocator) throws IOException {
    Schema schema =
        TestData.schema(
            TestData.int64("id"), TestData.int64("quantity"), TestData.float64("price"));
    List<List<Object[]>> batches = new ArrayList<>();
    long id = 0;
    for (int b = 0; b < BATCHES; b++) {
      List<Object[]> rows = new ArrayList<>();
      for (int r = 0; r < ROWS_PER_BATCH; r++, id++) {
        rows.add(row(id, id % 100, id / 4.0));
      }
      batches.add(rows);
    }
    return TestData.writeArrow(tempDir.resolve("large.arrow"), allocator, schema, batches);
  }

  @Test
  void testKeepsOnlyMatchingRowsInOrder() throws IOException {
    try (BufferAllocator allocator = new RootAllocator()) {
      TestData.writeArrow(
          tempDir.resolve("lineitem.arrow"),
          allocator,
          TestData.schema(TestData.int64("quantity")),
          List.of(batch(row(10L), row(40L)), batch(row(25L), row(60L))));
      BatchSource source = new LocalBatchSource(tempDir, allocator, 100);
      StreamingFilter filter = new StreamingFilter(config(64), allocator);

      try (FilterResult result =
          filter.filter(
              source,
              "lineitem",
              Predicates.compare("quantity", CompareOp.GT, 30L),
              null,
              ResultMode.IN_MEMORY,
              null)) {
        assertEquals(List.of(40L, 60L), TestData.column(result.root(), "quantity"));
        assertEquals(4, result.rowsScanned());
        assertEquals(2, result.rowsMatched());
        assertEquals(0, result.spillCount());
      }
      assertEquals(0, source.openReaders());
      assertEquals(0, allocator.getAllocatedMemory());
    }
  }

  @Test
  void testNaNPricesNeverMatch() throws IOException {
    try (BufferAllocator allocator = new RootAllocator()) {
      TestData.writeArrow(
          tempDir.resolve("prices.arrow"),
          allocator,
          TestData.schema(TestData.float64("price")),
          List.of(batch(row(Double.NaN), row(10.0)), batch(row(40.0))));
      BatchSource source = new LocalBatchSource(tempDir, allocator, 100);
      StreamingFilter filter = new StreamingFilter(config(64), allocator);

      try (FilterResult result =
          filter.filter(
              source,
              "prices",
              Predicates.parse("price > 30"),
              null,
              ResultMode.IN_MEMORY,
              null)) {
        assertEquals(List.of(40.0), TestData.column(result.root(), "price"));
        assertEquals(3, result.rowsScanned());
      }
      try (FilterResult result =
          filter.filter(
              source,
              "prices",
              Predicates.compare("price", CompareOp.NE, 0L),
              null,
              ResultMode.IN_MEMORY,
              null)) {
        assertEquals(List.of(10.0, 40.0), TestData.column(result.root(), "price"));
      }
      assertEquals(0, allocator.getAllocatedMemory());
    }
  }

  @Test
  void testOutputColumnsExcludeFilterOnlyColumns() throws IOException {
    try (BufferAllocator allocator = new RootAllocator()) {
      TestData.writeArrow(
          tempDir.resolve("orders.arrow"),
          allocator,
          TestData.schema(TestData.int64("id"), TestData.utf8("status")),
          List.of(batch(row(1L, "open"), row(2L, "closed"), row(3L, "open"))));
      BatchSource source = new LocalBatchSource(tempDir, allocator, 100);
      StreamingFilter filter = new StreamingFilter(config(64), allocator);

      try (FilterResult result =
          filter.filter(
              source,
              "orders",
              Predicates.parse("status = 'open'"),
              List.of("id"),
              ResultMode.IN_MEMORY,
              null)) {
        assertEquals(1, result.root().getSchema().getFields().size());
        assertEquals(List.of(1L, 3L), TestData.column(result.root(), "id"));
      }
    }
  }

  @Test
  void testResultDoesNotDependOnTheCeiling() throws IOException {
    try (BufferAllocator allocator = new RootAllocator()) {
      writeLarge(allocator);
      BatchSource source = new LocalBatchSource(tempDir, allocator, ROWS_PER_BATCH);
      RowPredicate predicate = Predicates.parse("quantity >= 50");

      List<Object> unbounded;
      try (FilterResult result =
          new StreamingFilter(config(10_240), allocator)
              .filter(
                  source,
                  "large",
                  predicate,
                  List.of("id", "quantity"),
                  ResultMode.IN_MEMORY,
                  null)) {
        unbounded = TestData.column(result.root(), "id");
      }

      Path output = tempDir.resolve("filtered.arrow");
      try (FilterResult result =
          new StreamingFilter(config(1), allocator)
              .filter(
                  source, "large", predicate, List.of("id", "quantity"), ResultMode.FILE, output)) {
        assertTrue(result.spillCount() >= 1);
        assertEquals(output, result.file());
        assertEquals(100_000, result.rowsMatched());
      }

      assertEquals(100_000, unbounded.size());
      assertEquals(unbounded, TestData.readColumn(output, allocator, "id"));
      try (Stream<Path> files = Files.list(tempDir.resolve("spill"))) {
        assertEquals(0, files.count());
      }
      assertEquals(0, allocator.getAllocatedMemory());
    }
  }

  @Test
  void testInMemoryResultOverTheCeilingRaisesWithReadableSpills() throws IOException {
    try (BufferAllocator allocator = new RootAllocator()) {
      writeLarge(allocator);
      BatchSource source = new LocalBatchSource(tempDir, allocator, ROWS_PER_BATCH);
      StreamingFilter filter = new StreamingFilter(config(1), allocator);

      ResourceExceededException e =
          assertThrows(
              ResourceExceededException.class,
              () ->
                  filter.filter(
                      source,
                      "large",
                      Predicates.parse("quantity >= 50"),
                      List.of("id", "quantity"),
                      ResultMode.IN_MEMORY,
                      null));

      SpillManifest manifest = e.manifest();
      assertEquals(100_000, manifest.totalRows());
      assertTrue(manifest.pendingMerge());
      try (RecordBatchReader reader = manifest.openReader(allocator)) {
        List<Object> quantities = TestData.drain(reader, "quantity");
        assertEquals(100_000, quantities.size());
        assertTrue(quantities.stream().allMatch(q -> (Long) q >= 50));
      }
      manifest.deleteAll();
      assertEquals(0, source.openReaders());
      assertEquals(0, allocator.getAllocatedMemory());
    }
  }

  @Test
  void testFileResultWithoutSpillsGetsGeneratedName() throws IOException {
    try (BufferAllocator allocator = new RootAllocator()) {
      TestData.writeLongs(tempDir.resolve("ids.arrow"), allocator, "id", new Long[] {1L, 2L, 3L});
      BatchSource source = new LocalBatchSource(tempDir, allocator, 100);

      try (FilterResult result =
          new StreamingFilter(config(64), allocator)
              .filter(
                  source,
                  "ids",
                  Predicates.compare("id", CompareOp.NE, 2L),
                  null,
                  ResultMode.FILE,
                  null)) {
        assertEquals(ResultMode.FILE, result.mode());
        assertEquals(0, result.spillCount());
        assertEquals(tempDir.resolve("spill"), result.file().getParent());
        assertEquals(List.of(1L, 3L), TestData.readColumn(result.file(), allocator, "id"));
        assertThrows(IllegalStateException.class, result::root);
      }
    }
  }

  @Test
  void testCancellationStopsAtBatchBoundary() throws IOException {
    try (BufferAllocator allocator = new RootAllocator()) {
      writeLarge(allocator);
      BatchSource source = new LocalBatchSource(tempDir, allocator, ROWS_PER_BATCH);
      CancellationToken token = new CancellationToken();
      RowPredicate cancelling =
          (batch, row) -> {
            token.cancel();
            return true;
          };

      assertThrows(
          OperationCancelledException.class,
          () ->
              new StreamingFilter(config(64), allocator)
                  .filter(
                      source,
                      "large",
                      cancelling,
                      List.of("id"),
                      ResultMode.IN_MEMORY,
                      null,
                      token));
      assertEquals(0, source.openReaders());
      assertEquals(0, allocator.getAllocatedMemory());
    }
  }

  @Test
  void testMissingPredicateIsRejected() {
    try (BufferAllocator allocator = new RootAllocator()) {
      BatchSource source = new LocalBatchSource(tempDir, allocator, 100);
      assertThrows(
          ConfigurationException.class,
          () ->
              new StreamingFilter(config(64), allocator)
                  .filter(source, "ids", null, null, ResultMode.IN_MEMORY, null));
    }
  }
}
