package io.streambatch.aggregate;

import io.streambatch.ColumnValues;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Running group table of an aggregation: group key to one accumulator per {@link AggregateSpec},
 * in first-appearance order of the keys.
 */
public final class AggregatorState {
  /** Rough per-value cost of a boxed key element or accumulator, used for size estimates. */
  private static final long BYTES_PER_SLOT = 48L;

  private static final long BYTES_PER_GROUP = 96L;

  private final List<AggregateSpec> specs;
  private final boolean[] integerInputs;
  private final Map<GroupKey, Accumulator[]> groups = new LinkedHashMap<>();
  private int keyWidth = -1;

  /**
   * @param specs aggregate columns, in output order
   * @param integerInputs per spec, whether its input column holds integers
   */
  public AggregatorState(List<AggregateSpec> specs, boolean[] integerInputs) {
    if (specs.size() != integerInputs.length) {
      throw new IllegalArgumentException("One integer flag per spec is required");
    }
    this.specs = List.copyOf(specs);
    this.integerInputs = integerInputs.clone();
  }

  /** Creates an empty accumulator row for a new group. */
  public Accumulator[] newAccumulators() {
    Accumulator[] row = new Accumulator[specs.size()];
    for (int i = 0; i < row.length; i++) {
      row[i] = Accumulators.create(specs.get(i).function(), integerInputs[i]);
    }
    return row;
  }

  /**
   * Merges a batch's partial group table into the running state. A key seen for the first time
   * takes over the partial accumulators as its initial state.
   */
  public void merge(Map<GroupKey, Accumulator[]> partial) {
    for (Map.Entry<GroupKey, Accumulator[]> entry : partial.entrySet()) {
      if (keyWidth < 0) {
        keyWidth = entry.getKey().size();
      }
      Accumulator[] existing = groups.get(entry.getKey());
      if (existing == null) {
        groups.put(entry.getKey(), entry.getValue());
      } else {
        Accumulator[] incoming = entry.getValue();
        for (int i = 0; i < existing.length; i++) {
          existing[i].merge(incoming[i]);
        }
      }
    }
  }

  public int groupCount() {
    return groups.size();
  }

  /** Approximate heap footprint of the group table. */
  public long estimatedBytes() {
    int width = Math.max(keyWidth, 0) + specs.size();
    return groups.size() * (BYTES_PER_GROUP + width * BYTES_PER_SLOT);
  }

  /** Read-only view of the group table. */
  public Map<GroupKey, Accumulator[]> groups() {
    return Collections.unmodifiableMap(groups);
  }

  /**
   * Writes one row per group, in first-appearance order.
   *
   * @param groupFields output fields of the group columns
   * @param aggregateFields output fields of the aggregate columns, one per spec
   * @param allocator allocator for the new root, owned by the caller
   */
  public VectorSchemaRoot toRoot(
      List<Field> groupFields, List<Field> aggregateFields, BufferAllocator allocator) {
    List<Field> fields = new ArrayList<>(groupFields);
    fields.addAll(aggregateFields);
    VectorSchemaRoot root = VectorSchemaRoot.create(new Schema(fields), allocator);
    try {
      root.allocateNew();
      List<FieldVector> vectors = root.getFieldVectors();
      int groupColumns = groupFields.size();
      int row = 0;
      for (Map.Entry<GroupKey, Accumulator[]> entry : groups.entrySet()) {
        GroupKey key = entry.getKey();
        for (int c = 0; c < groupColumns; c++) {
          ColumnValues.write(vectors.get(c), row, key.get(c));
        }
        Accumulator[] accumulators = entry.getValue();
        for (int a = 0; a < accumulators.length; a++) {
          ColumnValues.write(vectors.get(groupColumns + a), row, accumulators[a].result());
        }
        row++;
      }
      root.setRowCount(row);
      return root;
    } catch (RuntimeException e) {
      root.close();
      throw e;
    }
  }
}
