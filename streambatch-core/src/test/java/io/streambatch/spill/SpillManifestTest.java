package io.streambatch.spill;

import static org.junit.jupiter.api.Assertions.*;

import io.streambatch.RecordBatchReader;
import io.streambatch.StreamBatchException;
import io.streambatch.TestData;
import io.streambatch.config.SpillCompression;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class SpillManifestTest {

  @TempDir Path tempDir;

  private static Long[] range(long from, long to) {
    Long[] values = new Long[(int) (to - from)];
    for (int i = 0; i < values.length; i++) {
      values[i] = from + i;
    }
    return values;
  }

  private static SpillFile spill(
      SpillManifest manifest, Path source, BufferAllocator allocator, SpillCompression codec) {
    try (SpillWriter writer =
        SpillWriter.create(
            manifest.nextSpillPath(), TestData.schema(TestData.int64("id")), codec, allocator)) {
      writer.writeAll(source);
      SpillFile file = writer.finish();
      manifest.add(file);
      return file;
    }
  }

  @Test
  void testManifestFileTracksEverySpill() throws IOException {
    try (BufferAllocator allocator = new RootAllocator()) {
      Path first = TestData.writeLongs(tempDir.resolve("a.arrow"), allocator, "id", range(0, 5));
      Path second = TestData.writeLongs(tempDir.resolve("b.arrow"), allocator, "id", range(5, 8));
      Path spillDir = tempDir.resolve("spill");

      SpillManifest manifest = SpillManifest.create(spillDir, "filter");
      assertTrue(Files.exists(manifest.manifestPath()));
      assertTrue(manifest.isEmpty());
      assertFalse(manifest.pendingMerge());

      SpillFile a = spill(manifest, first, allocator, SpillCompression.LZ4_FRAME);
      spill(manifest, second, allocator, SpillCompression.UNCOMPRESSED);

      assertEquals(2, manifest.size());
      assertEquals(8, manifest.totalRows());
      assertTrue(manifest.totalBytes() > 0);
      assertTrue(manifest.pendingMerge());
      assertTrue(a.path().getFileName().toString().startsWith("filter-spill-0-"));

      SpillManifest loaded = SpillManifest.load(manifest.manifestPath());
      assertEquals("filter", loaded.operation());
      assertEquals(manifest.files(), loaded.files());
      assertTrue(loaded.pendingMerge());

      try (RecordBatchReader reader = loaded.openReader(allocator)) {
        assertEquals(
            List.of(0L, 1L, 2L, 3L, 4L, 5L, 6L, 7L), TestData.drain(reader, "id"));
      }
      assertEquals(0, allocator.getAllocatedMemory());

      loaded.deleteAll();
      assertFalse(Files.exists(manifest.manifestPath()));
      for (SpillFile file : manifest.files()) {
        assertFalse(Files.exists(file.path()));
      }
    }
  }

  @Test
  void testEmptyManifestHasNoReader() {
    SpillManifest manifest = SpillManifest.create(tempDir, "select");
    try (BufferAllocator allocator = new RootAllocator()) {
      assertThrows(IllegalStateException.class, () -> manifest.openReader(allocator));
    }
    manifest.deleteAll();
  }

  @Test
  void testMalformedManifestIsRejected() throws IOException {
    Path bad = tempDir.resolve("filter-broken.manifest");
    Files.writeString(bad, "# pending_merge=true\nnot a spill line\n");

    assertThrows(StreamBatchException.class, () -> SpillManifest.load(bad));
  }

  @Test
  void testUnfinishedWriterLeavesNoFile() {
    Path target = tempDir.resolve("partial.arrow");
    try (BufferAllocator allocator = new RootAllocator()) {
      try (SpillWriter writer =
          SpillWriter.create(
              target, TestData.schema(TestData.int64("id")), SpillCompression.ZSTD, allocator)) {
        assertTrue(Files.exists(target));
      }
      assertFalse(Files.exists(target));
      assertEquals(0, allocator.getAllocatedMemory());
    }
  }
}
