package io.streambatch;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * A boolean condition evaluated against one row of a batch.
 *
 * <p>Predicates built by {@link Predicates} report the columns they read through {@link
 * #columns()} so that sources can read them even when they are not part of the output
 * projection. A lambda reports no columns and therefore only sees the projected ones.
 */
@FunctionalInterface
public interface RowPredicate {

  /**
   * Evaluates the condition.
   *
   * @param batch the current batch
   * @param row a row index below {@code batch.getRowCount()}
   * @return whether the row matches
   */
  boolean test(VectorSchemaRoot batch, int row);

  /** Columns read by this predicate, in first-use order. */
  default List<String> columns() {
    return List.of();
  }

  /** Returns a predicate matching rows that match both this and {@code other}. */
  default RowPredicate and(RowPredicate other) {
    RowPredicate self = this;
    LinkedHashSet<String> both = new LinkedHashSet<>(self.columns());
    both.addAll(other.columns());
    List<String> columns = List.copyOf(new ArrayList<>(both));
    return new RowPredicate() {
      @Override
      public boolean test(VectorSchemaRoot batch, int row) {
        return self.test(batch, row) && other.test(batch, row);
      }

      @Override
      public List<String> columns() {
        return columns;
      }

      @Override
      public String toString() {
        return self + " AND " + other;
      }
    };
  }
}
