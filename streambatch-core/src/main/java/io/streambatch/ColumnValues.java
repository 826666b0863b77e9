package io.streambatch;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.FloatingPointVector;
import org.apache.arrow.vector.LargeVarCharVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;

/**
 * Reads and writes single cells of Arrow vectors as normalized Java values.
 *
 * <p>Normalization: every integer width reads as {@link Long}, floating point and decimal as
 * {@link Double}, text as {@link String}, booleans as {@link Boolean}; any other type reads as its
 * string form. Null cells read as {@code null}. Operators only ever see these four value classes,
 * which keeps group keys and comparisons independent of the physical column type.
 */
public final class ColumnValues {

  private static final ArrowType INT64 = new ArrowType.Int(64, true);
  private static final ArrowType FLOAT64 =
      new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);

  private ColumnValues() {}

  /**
   * Reads one cell as a normalized value.
   *
   * @param vector the column
   * @param row the row index
   * @return the value, or null for a null cell
   */
  public static Object read(FieldVector vector, int row) {
    if (vector.isNull(row)) {
      return null;
    }
    if (vector instanceof BaseIntVector) {
      return ((BaseIntVector) vector).getValueAsLong(row);
    }
    if (vector instanceof FloatingPointVector) {
      return ((FloatingPointVector) vector).getValueAsDouble(row);
    }
    if (vector instanceof BitVector) {
      return ((BitVector) vector).get(row) != 0;
    }
    if (vector instanceof VarCharVector) {
      return new String(((VarCharVector) vector).get(row), StandardCharsets.UTF_8);
    }
    if (vector instanceof LargeVarCharVector) {
      return new String(((LargeVarCharVector) vector).get(row), StandardCharsets.UTF_8);
    }
    if (vector instanceof DecimalVector) {
      return ((DecimalVector) vector).getObject(row).doubleValue();
    }
    Object value = vector.getObject(row);
    return value == null ? null : value.toString();
  }

  /**
   * Reads one cell as a double. Text is parsed; booleans, unparsable text and nulls are missing.
   *
   * @return the numeric value, or null when missing
   */
  public static Double readDouble(FieldVector vector, int row) {
    Object value = read(vector, row);
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof String) {
      return parseDouble((String) value);
    }
    return null;
  }

  /** Parses text as a double, returning null instead of throwing. */
  public static Double parseDouble(String text) {
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    try {
      return Double.parseDouble(trimmed);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** Null and NaN both mark a missing value. */
  public static boolean isMissing(Object value) {
    return value == null || (value instanceof Double && ((Double) value).isNaN());
  }

  /** Whether the field holds integers, floating point or decimals. */
  public static boolean isNumeric(Field field) {
    switch (field.getType().getTypeID()) {
      case Int:
      case FloatingPoint:
      case Decimal:
        return true;
      default:
        return false;
    }
  }

  /** Whether the field holds integers. */
  public static boolean isInteger(Field field) {
    return field.getType().getTypeID() == ArrowType.ArrowTypeID.Int;
  }

  /**
   * Returns the Arrow type that holds the normalized values of a field: Int64, Float64, Bool or
   * Utf8.
   */
  public static ArrowType normalizedType(Field field) {
    switch (field.getType().getTypeID()) {
      case Int:
        return INT64;
      case FloatingPoint:
      case Decimal:
        return FLOAT64;
      case Bool:
        return ArrowType.Bool.INSTANCE;
      default:
        return ArrowType.Utf8.INSTANCE;
    }
  }

  /** A nullable field called {@code name} holding the normalized values of {@code source}. */
  public static Field normalizedField(String name, Field source) {
    return new Field(name, FieldType.nullable(normalizedType(source)), null);
  }

  /** Creates a nullable field of the given type. */
  public static Field field(String name, ArrowType type) {
    return new Field(name, FieldType.nullable(type), null);
  }

  /** A nullable Int64 field. */
  public static Field int64(String name) {
    return field(name, INT64);
  }

  /** A nullable Float64 field. */
  public static Field float64(String name) {
    return field(name, FLOAT64);
  }

  /**
   * Writes a normalized value into a vector of one of the normalized types, growing the vector as
   * needed.
   *
   * @throws IllegalArgumentException if the vector is not one of the normalized types
   */
  public static void write(FieldVector vector, int row, Object value) {
    if (value == null) {
      setNull(vector, row);
    } else if (vector instanceof BigIntVector) {
      ((BigIntVector) vector).setSafe(row, ((Number) value).longValue());
    } else if (vector instanceof Float8Vector) {
      ((Float8Vector) vector).setSafe(row, ((Number) value).doubleValue());
    } else if (vector instanceof BitVector) {
      ((BitVector) vector).setSafe(row, ((Boolean) value) ? 1 : 0);
    } else if (vector instanceof VarCharVector) {
      ((VarCharVector) vector).setSafe(row, value.toString().getBytes(StandardCharsets.UTF_8));
    } else {
      throw new IllegalArgumentException(
          "Cannot write to vector of type " + vector.getField().getType());
    }
  }

  private static void setNull(FieldVector vector, int row) {
    if (vector instanceof BigIntVector) {
      ((BigIntVector) vector).setNull(row);
    } else if (vector instanceof Float8Vector) {
      ((Float8Vector) vector).setNull(row);
    } else if (vector instanceof BitVector) {
      ((BitVector) vector).setNull(row);
    } else if (vector instanceof VarCharVector) {
      ((VarCharVector) vector).setNull(row);
    } else {
      throw new IllegalArgumentException(
          "Cannot write to vector of type " + vector.getField().getType());
    }
  }

  /**
   * Orders two non-null normalized values. Numbers compare numerically across Long and Double;
   * values of unrelated classes compare by their string form.
   */
  @SuppressWarnings("unchecked")
  public static int compare(Object left, Object right) {
    if (left instanceof Long && right instanceof Long) {
      return Long.compare((Long) left, (Long) right);
    }
    if (left instanceof Number && right instanceof Number) {
      return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
    }
    if (left.getClass() == right.getClass() && left instanceof Comparable) {
      return ((Comparable<Object>) left).compareTo(right);
    }
    return left.toString().compareTo(right.toString());
  }

  /** Column names of a field list, in order. */
  public static List<String> names(List<Field> fields) {
    return fields.stream().map(Field::getName).collect(Collectors.toList());
  }
}
