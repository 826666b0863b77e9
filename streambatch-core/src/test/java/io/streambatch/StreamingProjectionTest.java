package io.streambatch;

import static io.streambatch.TestData.batch;
import static io.streambatch.TestData.row;
import static org.junit.jupiter.api.Assertions.*;

import io.streambatch.config.ProcessingConfig;
import io.streambatch.source.BatchSource;
import io.streambatch.source.LocalBatchSource;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class StreamingProjectionTest {

  @TempDir Path tempDir;

  private ProcessingConfig config;

  @BeforeEach
  void setUp() throws IOException {
    config = ProcessingConfig.builder().spillDirectory(tempDir.resolve("spill")).build();
    try (BufferAllocator allocator = new RootAllocator()) {
      TestData.writeArrow(
          tempDir.resolve("people.arrow"),
          allocator,
          TestData.schema(TestData.int64("id"), TestData.utf8("name"), TestData.float64("score")),
          List.of(
              batch(row(1L, "ada", 9.5), row(2L, "bob", 7.0)),
              batch(row(3L, "cy", 8.25)),
              batch(row(4L, "dee", 6.0), row(5L, "eve", 9.0))));
    }
  }

  @Test
  void testSelectsColumnsInRequestedOrder() {
    try (BufferAllocator allocator = new RootAllocator()) {
      BatchSource source = new LocalBatchSource(tempDir, allocator, 100);

      try (FilterResult result =
          new StreamingProjection(config, allocator)
              .select(source, "people", List.of("score", "id"), ResultMode.IN_MEMORY, null, 0)) {
        assertEquals(
            List.of("score", "id"), ColumnValues.names(result.root().getSchema().getFields()));
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), TestData.column(result.root(), "id"));
        assertEquals(5, result.rowsScanned());
      }
      assertEquals(0, allocator.getAllocatedMemory());
    }
  }

  @Test
  void testLimitStopsReadingEarly() {
    try (BufferAllocator allocator = new RootAllocator()) {
      BatchSource source = new LocalBatchSource(tempDir, allocator, 100);

      try (FilterResult result =
          new StreamingProjection(config, allocator)
              .select(source, "people", List.of("name"), ResultMode.IN_MEMORY, null, 3)) {
        assertEquals(List.of("ada", "bob", "cy"), TestData.column(result.root(), "name"));
        assertEquals(3, result.rowsMatched());
        // the third batch is never loaded
        assertEquals(3, result.rowsScanned());
      }
      assertEquals(0, source.openReaders());
    }
  }

  @Test
  void testLimitInsideABatchTruncatesIt() throws IOException {
    Path output = tempDir.resolve("preview.arrow");
    try (BufferAllocator allocator = new RootAllocator()) {
      BatchSource source = new LocalBatchSource(tempDir, allocator, 100);

      try (FilterResult result =
          new StreamingProjection(config, allocator)
              .select(source, "people", List.of("id"), ResultMode.FILE, output, 1)) {
        assertEquals(1, result.rowsMatched());
      }
      assertEquals(List.of(1L), TestData.readColumn(output, allocator, "id"));
    }
  }

  @Test
  void testInvalidSelections() {
    try (BufferAllocator allocator = new RootAllocator()) {
      BatchSource source = new LocalBatchSource(tempDir, allocator, 100);
      StreamingProjection projection = new StreamingProjection(config, allocator);

      assertThrows(
          ConfigurationException.class,
          () -> projection.select(source, "people", List.of(), ResultMode.IN_MEMORY, null, 0));
      assertThrows(
          ConfigurationException.class,
          () ->
              projection.select(source, "people", List.of("id"), ResultMode.IN_MEMORY, null, -1));
      assertThrows(
          ColumnNotFoundException.class,
          () ->
              projection.select(source, "people", List.of("age"), ResultMode.IN_MEMORY, null, 0));
    }
  }
}
