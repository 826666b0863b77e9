package io.streambatch.spill;

import static org.junit.jupiter.api.Assertions.*;

import io.streambatch.ConfigurationException;
import io.streambatch.TestData;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.junit.jupiter.api.Test;

public class MemoryGovernorTest {

  @Test
  void testCeilingIsExclusive() {
    MemoryGovernor governor = MemoryGovernor.ofBytes(1000);

    assertFalse(governor.shouldSpill(0));
    assertFalse(governor.shouldSpill(1000));
    assertTrue(governor.shouldSpill(1001));
    assertTrue(governor.fits(1000));
    assertFalse(governor.fits(1001));
  }

  @Test
  void testMegabytes() {
    assertEquals(2L * 1024 * 1024, MemoryGovernor.ofMegabytes(2).ceilingBytes());
  }

  @Test
  void testNonPositiveCeilingIsRejected() {
    assertThrows(ConfigurationException.class, () -> MemoryGovernor.ofMegabytes(0));
    assertThrows(ConfigurationException.class, () -> MemoryGovernor.ofBytes(-5));
  }

  @Test
  void testEstimateGrowsWithRows() {
    try (BufferAllocator allocator = new RootAllocator();
        VectorSchemaRoot small =
            VectorSchemaRoot.create(TestData.schema(TestData.int64("id")), allocator);
        VectorSchemaRoot large =
            VectorSchemaRoot.create(TestData.schema(TestData.int64("id")), allocator)) {
      fill(small, 10);
      fill(large, 10_000);

      assertTrue(MemoryGovernor.estimateBytes(small) > 0);
      assertTrue(MemoryGovernor.estimateBytes(large) >= 10_000 * Long.BYTES);
      assertTrue(MemoryGovernor.estimateBytes(large) > MemoryGovernor.estimateBytes(small));
    }
  }

  private static void fill(VectorSchemaRoot root, int rows) {
    BigIntVector vector = (BigIntVector) root.getVector("id");
    vector.allocateNew(rows);
    for (int i = 0; i < rows; i++) {
      vector.set(i, i);
    }
    root.setRowCount(rows);
  }
}
