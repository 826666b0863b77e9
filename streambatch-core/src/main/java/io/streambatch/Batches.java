package io.streambatch;

import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

/** Row copying and sizing helpers for {@link VectorSchemaRoot}s with identical schemas. */
public final class Batches {

  private Batches() {}

  /**
   * Copies a contiguous run of rows into {@code target}, replacing its previous contents.
   *
   * @param source the batch to copy from
   * @param offset first source row
   * @param length number of rows
   * @param target a root whose vectors have the same types, in the same order
   */
  public static void copyRange(
      VectorSchemaRoot source, int offset, int length, VectorSchemaRoot target) {
    List<FieldVector> from = source.getFieldVectors();
    List<FieldVector> to = target.getFieldVectors();
    target.allocateNew();
    for (int c = 0; c < from.size(); c++) {
      FieldVector src = from.get(c);
      FieldVector dst = to.get(c);
      for (int i = 0; i < length; i++) {
        dst.copyFromSafe(offset + i, i, src);
      }
    }
    target.setRowCount(length);
  }

  /**
   * Copies selected rows of {@code source} into a new root owned by the caller.
   *
   * @param source the batch to copy from
   * @param rows indexes of the rows to copy, in output order
   * @param count number of valid entries in {@code rows}
   * @param allocator allocator for the new root
   * @return a new root with {@code count} rows
   */
  public static VectorSchemaRoot copySelected(
      VectorSchemaRoot source, int[] rows, int count, BufferAllocator allocator) {
    return copySelected(source.getSchema(), source.getFieldVectors(), rows, count, allocator);
  }

  /**
   * Copies selected rows of a subset of a batch's vectors into a new root owned by the caller.
   *
   * @param schema schema of the new root, matching {@code from} position by position
   * @param from the source vectors
   * @param rows indexes of the rows to copy, in output order
   * @param count number of valid entries in {@code rows}
   * @param allocator allocator for the new root
   */
  public static VectorSchemaRoot copySelected(
      Schema schema, List<FieldVector> from, int[] rows, int count, BufferAllocator allocator) {
    VectorSchemaRoot copy = VectorSchemaRoot.create(schema, allocator);
    try {
      copy.allocateNew();
      List<FieldVector> to = copy.getFieldVectors();
      for (int c = 0; c < from.size(); c++) {
        FieldVector src = from.get(c);
        FieldVector dst = to.get(c);
        for (int i = 0; i < count; i++) {
          dst.copyFromSafe(rows[i], i, src);
        }
      }
      copy.setRowCount(count);
      return copy;
    } catch (RuntimeException e) {
      copy.close();
      throw e;
    }
  }

  /**
   * Concatenates batches into one new root owned by the caller. The input batches are left
   * untouched.
   */
  public static VectorSchemaRoot concat(
      Schema schema, List<VectorSchemaRoot> batches, BufferAllocator allocator) {
    VectorSchemaRoot result = VectorSchemaRoot.create(schema, allocator);
    try {
      result.allocateNew();
      List<FieldVector> to = result.getFieldVectors();
      int outRow = 0;
      for (VectorSchemaRoot batch : batches) {
        List<FieldVector> from = batch.getFieldVectors();
        int rows = batch.getRowCount();
        for (int c = 0; c < from.size(); c++) {
          FieldVector src = from.get(c);
          FieldVector dst = to.get(c);
          for (int i = 0; i < rows; i++) {
            dst.copyFromSafe(i, outRow + i, src);
          }
        }
        outRow += rows;
      }
      result.setRowCount(outRow);
      return result;
    } catch (RuntimeException e) {
      result.close();
      throw e;
    }
  }

  /** Approximate in-memory size of a batch: the sum of its vectors' buffer sizes. */
  public static long estimateBytes(VectorSchemaRoot batch) {
    long bytes = 0;
    for (FieldVector vector : batch.getFieldVectors()) {
      bytes += vector.getBufferSize();
    }
    return bytes;
  }
}
