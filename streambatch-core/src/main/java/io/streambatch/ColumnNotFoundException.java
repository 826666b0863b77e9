package io.streambatch;

import java.util.List;

/**
 * Raised when a projected, grouped or summarized column is absent from the source schema.
 *
 * <p>Always thrown when the reader is opened, before any batch is read.
 */
public class ColumnNotFoundException extends NotFoundException {
  private final String column;
  private final String dataset;

  public ColumnNotFoundException(String column, String dataset, List<String> available) {
    super("Column '" + column + "' not found in " + dataset + "; available columns: " + available);
    this.column = column;
    this.dataset = dataset;
  }

  public String column() {
    return column;
  }

  public String dataset() {
    return dataset;
  }
}
