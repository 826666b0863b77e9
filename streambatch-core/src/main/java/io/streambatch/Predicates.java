package io.streambatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * Factory and parser for {@link RowPredicate}s.
 *
 * <p>The textual form is a conjunction of comparisons:
 *
 * <pre>
 *   quantity &gt; 30 AND flag = 'R'
 * </pre>
 *
 * Column names are bare identifiers (letters, digits, {@code _} and {@code .}) or double-quoted.
 * Literals are single-quoted strings, numbers, {@code true} or {@code false}. A comparison against
 * a null cell never matches.
 */
public final class Predicates {

  private Predicates() {}

  /**
   * Compares a column against a literal.
   *
   * @param column column name
   * @param op operator
   * @param literal a {@link Long}, {@link Double}, {@link String} or {@link Boolean}; other
   *     numbers are normalized
   */
  public static RowPredicate compare(String column, CompareOp op, Object literal) {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(op, "op");
    Object value = normalize(Objects.requireNonNull(literal, "literal"));
    return new Comparison(column, op, value);
  }

  /** Conjunction of all given predicates. An empty array matches every row. */
  public static RowPredicate and(RowPredicate... predicates) {
    RowPredicate result = (batch, row) -> true;
    for (RowPredicate predicate : predicates) {
      result = result.and(predicate);
    }
    return result;
  }

  /**
   * Parses a filter expression.
   *
   * @param expression the expression text
   * @return the predicate
   * @throws ConfigurationException if the text is not a valid expression
   */
  public static RowPredicate parse(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new ConfigurationException("Empty filter expression");
    }
    List<String> tokens = tokenize(expression);
    List<RowPredicate> terms = new ArrayList<>();
    int i = 0;
    while (true) {
      if (i + 3 > tokens.size()) {
        throw new ConfigurationException("Incomplete comparison in filter: " + expression);
      }
      String column = identifier(tokens.get(i), expression);
      CompareOp op;
      try {
        op = CompareOp.fromSymbol(tokens.get(i + 1));
      } catch (ConfigurationException e) {
        throw new ConfigurationException(e.getMessage() + " in filter: " + expression);
      }
      Object literal = literal(tokens.get(i + 2), expression);
      terms.add(new Comparison(column, op, literal));
      i += 3;
      if (i == tokens.size()) {
        break;
      }
      if (!tokens.get(i).equalsIgnoreCase("AND")) {
        throw new ConfigurationException(
            "Expected AND but found '" + tokens.get(i) + "' in filter: " + expression);
      }
      i++;
    }
    RowPredicate result = terms.get(0);
    for (int t = 1; t < terms.size(); t++) {
      result = result.and(terms.get(t));
    }
    return result;
  }

  static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    int i = 0;
    int n = text.length();
    while (i < n) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (c == '\'' || c == '"') {
        int end = i + 1;
        StringBuilder sb = new StringBuilder().append(c);
        while (true) {
          if (end >= n) {
            throw new ConfigurationException("Unterminated quote in filter: " + text);
          }
          char d = text.charAt(end);
          if (d == c) {
            // doubled quote is an escaped quote
            if (end + 1 < n && text.charAt(end + 1) == c) {
              sb.append(c);
              end += 2;
              continue;
            }
            break;
          }
          sb.append(d);
          end++;
        }
        tokens.add(sb.append(c).toString());
        i = end + 1;
      } else if (c == '<' || c == '>' || c == '=' || c == '!') {
        int end = i + 1;
        if (end < n && (text.charAt(end) == '=' || (c == '<' && text.charAt(end) == '>'))) {
          end++;
        }
        tokens.add(text.substring(i, end));
        i = end;
      } else {
        int end = i;
        while (end < n && isWordChar(text.charAt(end))) {
          end++;
        }
        if (end == i) {
          throw new ConfigurationException(
              "Unexpected character '" + c + "' in filter: " + text);
        }
        tokens.add(text.substring(i, end));
        i = end;
      }
    }
    return tokens;
  }

  private static boolean isWordChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-' || c == '+';
  }

  private static String identifier(String token, String expression) {
    if (token.startsWith("\"")) {
      return token.substring(1, token.length() - 1);
    }
    if (token.startsWith("'") || !Character.isLetter(token.charAt(0)) && token.charAt(0) != '_') {
      throw new ConfigurationException(
          "Expected a column name but found " + token + " in filter: " + expression);
    }
    return token;
  }

  private static Object literal(String token, String expression) {
    if (token.startsWith("'")) {
      return token.substring(1, token.length() - 1);
    }
    if (token.equalsIgnoreCase("true") || token.equalsIgnoreCase("false")) {
      return Boolean.valueOf(token.toLowerCase(Locale.ROOT));
    }
    try {
      return Long.parseLong(token);
    } catch (NumberFormatException e) {
      // not an integer, try a decimal below
    }
    try {
      return Double.parseDouble(token);
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
          "Expected a literal but found " + token + " in filter: " + expression);
    }
  }

  private static Object normalize(Object literal) {
    if (literal instanceof Long || literal instanceof Double) {
      return literal;
    }
    if (literal instanceof Integer || literal instanceof Short || literal instanceof Byte) {
      return ((Number) literal).longValue();
    }
    if (literal instanceof Number) {
      return ((Number) literal).doubleValue();
    }
    if (literal instanceof Boolean || literal instanceof String) {
      return literal;
    }
    return literal.toString();
  }

  private static final class Comparison implements RowPredicate {
    private final String column;
    private final CompareOp op;
    private final Object literal;
    private final Double numericLiteral;

    Comparison(String column, CompareOp op, Object literal) {
      this.column = column;
      this.op = op;
      this.literal = literal;
      this.numericLiteral =
          literal instanceof String ? ColumnValues.parseDouble((String) literal) : null;
    }

    @Override
    public boolean test(VectorSchemaRoot batch, int row) {
      FieldVector vector = batch.getVector(column);
      if (vector == null) {
        throw new ColumnNotFoundException(
            column, "filter input", ColumnValues.names(batch.getSchema().getFields()));
      }
      Object value = ColumnValues.read(vector, row);
      if (ColumnValues.isMissing(value)) {
        return false;
      }
      Object against = literal;
      if (value instanceof String && literal instanceof Number) {
        Double parsed = ColumnValues.parseDouble((String) value);
        if (ColumnValues.isMissing(parsed)) {
          return false;
        }
        value = parsed;
      } else if (value instanceof Number && literal instanceof String) {
        // numeric column against a quoted literal compares numerically
        if (ColumnValues.isMissing(numericLiteral)) {
          return false;
        }
        against = numericLiteral;
      }
      return op.accepts(ColumnValues.compare(value, against));
    }

    @Override
    public List<String> columns() {
      return List.of(column);
    }

    @Override
    public String toString() {
      Object shown = literal instanceof String ? "'" + literal + "'" : literal;
      return column + " " + op.symbol() + " " + shown;
    }
  }
}
