package io.streambatch;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.jupiter.api.Test;

/** Tests for filter expression parsing and evaluation. */
public class PredicatesTest {

  private static VectorSchemaRoot lineItems(BufferAllocator allocator) {
    Schema schema =
        TestData.schema(
            TestData.int64("quantity"), TestData.utf8("flag"), TestData.float64("price"));
    VectorSchemaRoot root = VectorSchemaRoot.create(schema, allocator);
    root.allocateNew();
    Object[][] rows = {
      {10L, "R", 1.5}, {40L, "R", 2.0}, {25L, "N", null}, {60L, "A", 9.25}, {null, "R", 3.0}
    };
    List<FieldVector> vectors = root.getFieldVectors();
    for (int r = 0; r < rows.length; r++) {
      for (int c = 0; c < vectors.size(); c++) {
        ColumnValues.write(vectors.get(c), r, rows[r][c]);
      }
    }
    root.setRowCount(rows.length);
    return root;
  }

  private static List<Integer> matches(RowPredicate predicate, VectorSchemaRoot root) {
    List<Integer> rows = new ArrayList<>();
    for (int row = 0; row < root.getRowCount(); row++) {
      if (predicate.test(root, row)) {
        rows.add(row);
      }
    }
    return rows;
  }

  @Test
  void testParseConjunction() {
    try (BufferAllocator allocator = new RootAllocator();
        VectorSchemaRoot root = lineItems(allocator)) {
      RowPredicate predicate = Predicates.parse("quantity > 30 AND flag = 'R'");

      assertEquals(List.of(1), matches(predicate, root));
      assertEquals(List.of("quantity", "flag"), predicate.columns());
    }
  }

  @Test
  void testNullNeverMatches() {
    try (BufferAllocator allocator = new RootAllocator();
        VectorSchemaRoot root = lineItems(allocator)) {
      assertEquals(List.of(0, 2), matches(Predicates.parse("quantity < 30"), root));
      assertEquals(List.of(0, 1, 2, 3), matches(Predicates.parse("quantity != 99"), root));
      assertEquals(List.of(0, 1, 4), matches(Predicates.parse("price <= 3"), root));
    }
  }

  @Test
  void testNaNNeverMatches() {
    try (BufferAllocator allocator = new RootAllocator();
        VectorSchemaRoot root =
            VectorSchemaRoot.create(TestData.schema(TestData.float64("price")), allocator)) {
      root.allocateNew();
      FieldVector price = root.getVector("price");
      ColumnValues.write(price, 0, Double.NaN);
      ColumnValues.write(price, 1, 10.0);
      ColumnValues.write(price, 2, 40.0);
      root.setRowCount(3);

      assertEquals(List.of(2), matches(Predicates.parse("price > 30"), root));
      assertEquals(List.of(2), matches(Predicates.parse("price >= 30"), root));
      assertEquals(List.of(1, 2), matches(Predicates.parse("price != 5"), root));
      assertEquals(List.of(1), matches(Predicates.parse("price < 30"), root));
    }
  }

  @Test
  void testQuotedNumberAgainstNumericColumnComparesNumerically() {
    try (BufferAllocator allocator = new RootAllocator();
        VectorSchemaRoot root = lineItems(allocator)) {
      // as strings "10" < "5" would hold; numerically it does not
      assertEquals(List.of(0, 1, 2, 3), matches(Predicates.parse("quantity > '5'"), root));
      assertEquals(List.of(3), matches(Predicates.parse("price = '9.25'"), root));
      assertEquals(List.of(), matches(Predicates.parse("quantity > 'abc'"), root));
    }
  }

  @Test
  void testOperatorsAndLiterals() {
    try (BufferAllocator allocator = new RootAllocator();
        VectorSchemaRoot root = lineItems(allocator)) {
      assertEquals(List.of(1, 3), matches(Predicates.parse("quantity>=40"), root));
      assertEquals(List.of(2, 3), matches(Predicates.parse("flag <> 'R'"), root));
      assertEquals(List.of(3), matches(Predicates.parse("flag <> 'R' and price > 5"), root));
    }
  }

  @Test
  void testProgrammaticCompare() {
    try (BufferAllocator allocator = new RootAllocator();
        VectorSchemaRoot root = lineItems(allocator)) {
      RowPredicate predicate =
          Predicates.and(
              Predicates.compare("quantity", CompareOp.GE, 25),
              Predicates.compare("price", CompareOp.LT, 5.0));
      assertEquals(List.of(1), matches(predicate, root));
      assertEquals(List.of("quantity", "price"), predicate.columns());
    }
  }

  @Test
  void testQuotedStringWithEscapedQuote() {
    RowPredicate predicate = Predicates.parse("name = 'O''Brien'");
    assertEquals("name = 'O'Brien'", predicate.toString());
  }

  @Test
  void testInvalidExpressions() {
    assertThrows(ConfigurationException.class, () -> Predicates.parse(""));
    assertThrows(ConfigurationException.class, () -> Predicates.parse("quantity >"));
    assertThrows(ConfigurationException.class, () -> Predicates.parse("quantity ~ 3"));
    assertThrows(
        ConfigurationException.class, () -> Predicates.parse("quantity > 3 OR flag = 'R'"));
    assertThrows(ConfigurationException.class, () -> Predicates.parse("flag = 'R"));
    assertThrows(ConfigurationException.class, () -> Predicates.parse("30 < quantity"));
  }
}
