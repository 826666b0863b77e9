package io.streambatch.source;

import io.streambatch.BatchReadException;
import io.streambatch.ColumnNotFoundException;
import io.streambatch.ColumnValues;
import io.streambatch.RecordBatchReader;
import io.streambatch.RowPredicate;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base reader that turns format-specific input batches into bounded, projected, filtered output
 * batches.
 *
 * <p>Subclasses produce input batches through {@link #nextInput()}; this class selects the rows
 * that match the filter and copies them, at most {@code batchSize} at a time, into a reused output
 * root holding only the projected columns.
 */
abstract class ProjectingBatchReader implements RecordBatchReader {
  private static final Logger logger = LoggerFactory.getLogger(ProjectingBatchReader.class);

  protected final String dataset;
  protected final BufferAllocator allocator;
  private final int batchSize;
  private final Runnable onClose;
  private Schema outputSchema;
  private VectorSchemaRoot outRoot;
  private RowPredicate filter;
  private VectorSchemaRoot input;
  private int[] selection = new int[0];
  private int selectionCount;
  private int selectionPosition;
  private int inputBatches;
  private int batchCount;
  private boolean closed;

  /**
   * @param dataset dataset name used in errors and logs
   * @param allocator allocator owned by this reader and closed with it
   * @param batchSize maximum rows per output batch
   * @param onClose called once when the reader is closed
   */
  ProjectingBatchReader(
      String dataset, BufferAllocator allocator, int batchSize, Runnable onClose) {
    this.dataset = dataset;
    this.allocator = allocator;
    this.batchSize = batchSize;
    this.onClose = onClose;
  }

  /**
   * Fixes the output schema. Called once by the subclass constructor, after the input schema is
   * known and before any batch is produced.
   *
   * @param inputSchema schema of the input batches
   * @param columns projected columns, or null for all
   * @param filter row filter, or null
   * @throws ColumnNotFoundException if a projected or filtered column is absent
   */
  protected final void bind(Schema inputSchema, List<String> columns, RowPredicate filter) {
    List<Field> projected = project(dataset, inputSchema, columns);
    if (filter != null) {
      project(dataset, inputSchema, filter.columns());
    }
    this.filter = filter;
    this.outputSchema = new Schema(projected);
    this.outRoot = VectorSchemaRoot.create(outputSchema, allocator);
  }

  /**
   * Resolves column names against a schema.
   *
   * @return the fields in {@code columns} order, or every field when {@code columns} is null
   */
  static List<Field> project(String dataset, Schema schema, List<String> columns) {
    if (columns == null) {
      return schema.getFields();
    }
    List<Field> fields = new ArrayList<>(columns.size());
    for (String column : columns) {
      Field field = findField(schema, column);
      if (field == null) {
        throw new ColumnNotFoundException(column, dataset, ColumnValues.names(schema.getFields()));
      }
      fields.add(field);
    }
    return fields;
  }

  /** Projected columns followed by the filter's other columns, or null when all are needed. */
  static List<String> requiredColumns(List<String> columns, RowPredicate filter) {
    if (columns == null) {
      return null;
    }
    LinkedHashSet<String> required = new LinkedHashSet<>(columns);
    if (filter != null) {
      required.addAll(filter.columns());
    }
    return new ArrayList<>(required);
  }

  private static Field findField(Schema schema, String name) {
    for (Field field : schema.getFields()) {
      if (field.getName().equals(name)) {
        return field;
      }
    }
    return null;
  }

  /**
   * Produces the next input batch.
   *
   * @return a loaded root, valid until the next call; null at the end of the data
   */
  protected abstract VectorSchemaRoot nextInput() throws IOException;

  /** Releases the subclass's input resources. Must not throw. */
  protected abstract void closeInput();

  @Override
  public Schema getSchema() {
    return outputSchema;
  }

  @Override
  public VectorSchemaRoot getVectorSchemaRoot() {
    return outRoot;
  }

  @Override
  public boolean loadNextBatch() {
    if (closed) {
      return false;
    }
    while (true) {
      if (input != null && selectionPosition < selectionCount) {
        int length = Math.min(batchSize, selectionCount - selectionPosition);
        copySelection(length);
        selectionPosition += length;
        batchCount++;
        logger.debug("Loaded batch {} of {} with {} rows", batchCount, dataset, length);
        return true;
      }
      VectorSchemaRoot next;
      try {
        next = nextInput();
      } catch (IOException e) {
        throw new BatchReadException(dataset, batchCount, e);
      }
      if (next == null) {
        input = null;
        return false;
      }
      inputBatches++;
      input = next;
      select();
    }
  }

  private void select() {
    int rows = input.getRowCount();
    if (selection.length < rows) {
      selection = new int[rows];
    }
    int count = 0;
    for (int row = 0; row < rows; row++) {
      if (filter == null || filter.test(input, row)) {
        selection[count++] = row;
      }
    }
    selectionCount = count;
    selectionPosition = 0;
  }

  private void copySelection(int length) {
    outRoot.allocateNew();
    List<FieldVector> targets = outRoot.getFieldVectors();
    for (FieldVector target : targets) {
      FieldVector source = input.getVector(target.getName());
      for (int i = 0; i < length; i++) {
        target.copyFromSafe(selection[selectionPosition + i], i, source);
      }
    }
    outRoot.setRowCount(length);
  }

  @Override
  public int batchCount() {
    return batchCount;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    input = null;
    closeInput();
    if (outRoot != null) {
      outRoot.close();
    }
    try {
      allocator.close();
    } catch (IllegalStateException e) {
      logger.error("Allocator for {} still had outstanding buffers", dataset, e);
    }
    onClose.run();
    logger.debug(
        "Closed reader for {} after {} input and {} output batches",
        dataset,
        inputBatches,
        batchCount);
  }
}
