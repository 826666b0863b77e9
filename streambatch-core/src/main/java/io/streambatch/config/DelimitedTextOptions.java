package io.streambatch.config;

import io.streambatch.ConfigurationException;
import java.util.List;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Parsing options for delimited text datasets ({@code .csv}, {@code .dat}, {@code .tbl}).
 *
 * <p>All fields except {@code delimiter} are optional. A null {@code columnNames} means names come
 * from the header row, or are generated as {@code column_0, column_1, ...} when there is none. A
 * null {@code schema} means column types are inferred from the first {@code inferenceRows} data
 * rows, independent of the batch size.
 *
 * @param delimiter the field separator
 * @param hasHeader whether the first non-blank line names the columns
 * @param trailingDelimiter whether every line ends with one extra delimiter (TPC-H {@code .tbl})
 * @param columnNames explicit column names, overriding the header
 * @param schema explicit Arrow schema; disables type inference
 * @param inferenceRows number of leading data rows sampled for type inference
 */
public record DelimitedTextOptions(
    char delimiter,
    boolean hasHeader,
    boolean trailingDelimiter,
    List<String> columnNames,
    Schema schema,
    int inferenceRows) {

  public static final int DEFAULT_INFERENCE_ROWS = 1_000;

  /** Comma separated with a header row; used for {@code .csv} and {@code .dat}. */
  public static DelimitedTextOptions csv() {
    return builder().delimiter(',').hasHeader(true).build();
  }

  /** Pipe separated, headerless, one trailing delimiter per line; used for {@code .tbl}. */
  public static DelimitedTextOptions tbl() {
    return builder().delimiter('|').hasHeader(false).trailingDelimiter(true).build();
  }

  /** Returns a new builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link DelimitedTextOptions}. */
  public static final class Builder {
    private char delimiter = ',';
    private boolean hasHeader = true;
    private boolean trailingDelimiter = false;
    private List<String> columnNames;
    private Schema schema;
    private int inferenceRows = DEFAULT_INFERENCE_ROWS;

    private Builder() {}

    /** Field separator. Default is a comma. */
    public Builder delimiter(char value) {
      this.delimiter = value;
      return this;
    }

    /** Whether the first line is a header. Default is true. */
    public Builder hasHeader(boolean value) {
      this.hasHeader = value;
      return this;
    }

    /** Whether each line ends with a delimiter that must be stripped. Default is false. */
    public Builder trailingDelimiter(boolean value) {
      this.trailingDelimiter = value;
      return this;
    }

    /** Explicit column names, in file order. */
    public Builder columnNames(List<String> value) {
      this.columnNames = value == null ? null : List.copyOf(value);
      return this;
    }

    /** Explicit schema, in file order. Column names are taken from the schema's fields. */
    public Builder schema(Schema value) {
      this.schema = value;
      return this;
    }

    /**
     * Leading data rows read ahead to infer column types. Default is {@value
     * #DEFAULT_INFERENCE_ROWS}.
     */
    public Builder inferenceRows(int value) {
      this.inferenceRows = value;
      return this;
    }

    /** Builds the {@link DelimitedTextOptions}. */
    public DelimitedTextOptions build() {
      if (delimiter == '"' || delimiter == '\n' || delimiter == '\r') {
        throw new ConfigurationException("Unsupported delimiter: '" + delimiter + "'");
      }
      if (inferenceRows <= 0) {
        throw new ConfigurationException("inferenceRows must be positive, got " + inferenceRows);
      }
      if (columnNames != null
          && schema != null
          && columnNames.size() != schema.getFields().size()) {
        throw new ConfigurationException(
            "columnNames and schema disagree: "
                + columnNames.size()
                + " names, "
                + schema.getFields().size()
                + " fields");
      }
      return new DelimitedTextOptions(
          delimiter, hasHeader, trailingDelimiter, columnNames, schema, inferenceRows);
    }
  }
}
