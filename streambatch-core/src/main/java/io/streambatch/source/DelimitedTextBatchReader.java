package io.streambatch.source;

import io.streambatch.BatchReadException;
import io.streambatch.ColumnValues;
import io.streambatch.FormatUnsupportedException;
import io.streambatch.RowPredicate;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.streambatch.config.DelimitedTextOptions;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses delimited text ({@code .csv}, {@code .dat}, {@code .tbl}) into Arrow batches.
 *
 * <p>Records are tokenized by Jackson's CSV parser, so quoted cells may contain the delimiter,
 * doubled quotes and line breaks. Blank lines are skipped.
 *
 * <p>Only the projected and filtered columns are materialized. Column types come from the
 * explicit schema when one is configured, otherwise they are inferred from the first {@link
 * DelimitedTextOptions#inferenceRows()} data rows, whatever the batch size: Int64 when every
 * non-empty value is a long, Float64 when every one is a double, Utf8 otherwise. Empty cells, and
 * values past the sampled rows that do not fit the inferred type, are read as null.
 */
final class DelimitedTextBatchReader extends ProjectingBatchReader {
  private static final Logger logger = LoggerFactory.getLogger(DelimitedTextBatchReader.class);

  private static final CsvMapper MAPPER =
      CsvMapper.builder()
          .enable(CsvParser.Feature.WRAP_AS_ARRAY)
          .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
          .build();

  private final MappingIterator<String[]> records;
  private final DelimitedTextOptions options;
  private final int batchSize;
  private final int[] fileIndexes;
  private final VectorSchemaRoot inputRoot;
  private final Deque<String[]> pending = new ArrayDeque<>();
  private long recordsRead;
  private int inputBatches;
  private boolean exhausted;

  /**
   * Reads the header and the inference sample, infers the schema and validates the projection.
   * The stream is owned by the reader from here on and closed even if opening fails.
   */
  DelimitedTextBatchReader(
      String dataset,
      InputStream in,
      DelimitedTextOptions options,
      BufferAllocator parent,
      int batchSize,
      List<String> columns,
      RowPredicate filter,
      Runnable onClose) {
    super(
        dataset,
        parent.newChildAllocator("delimited-text:" + dataset, 0, Long.MAX_VALUE),
        batchSize,
        onClose);
    this.options = options;
    this.batchSize = batchSize;
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(options.delimiter());
    VectorSchemaRoot root = null;
    MappingIterator<String[]> opened = null;
    try {
      opened =
          MAPPER
              .readerFor(String[].class)
              .with(schema)
              .readValues(new InputStreamReader(in, decoder));
      this.records = opened;
      String[] header = null;
      if (options.hasHeader()) {
        header =
            records.hasNextValue() ? stripTrailingDelimiter(records.nextValue()) : new String[0];
      }
      List<String[]> sample = readRecords(options.inferenceRows());
      List<String> names = columnNames(header, sample);

      List<Field> fileFields = new ArrayList<>(names.size());
      for (String name : names) {
        fileFields.add(ColumnValues.field(name, ArrowType.Utf8.INSTANCE));
      }
      List<String> required = requiredColumns(columns, filter);
      List<Field> requiredFields = project(dataset, new Schema(fileFields), required);

      this.fileIndexes = new int[requiredFields.size()];
      List<Field> inputFields = new ArrayList<>(requiredFields.size());
      for (int c = 0; c < requiredFields.size(); c++) {
        String name = requiredFields.get(c).getName();
        int index = names.indexOf(name);
        fileIndexes[c] = index;
        inputFields.add(inputField(name, index, sample));
      }
      pending.addAll(keepRequired(sample));
      Schema inputSchema = new Schema(inputFields);
      root = VectorSchemaRoot.create(inputSchema, allocator);
      this.inputRoot = root;
      bind(inputSchema, columns, filter);
    } catch (IOException e) {
      release(root, opened, in);
      if (isCodingError(e)) {
        throw new FormatUnsupportedException("Not valid UTF-8 text: " + dataset, e);
      }
      throw new BatchReadException(dataset, 0, e);
    } catch (RuntimeException e) {
      release(root, opened, in);
      throw e;
    }
    logger.debug("Opened {} with input schema {}", dataset, inputRoot.getSchema());
  }

  private void release(VectorSchemaRoot root, MappingIterator<String[]> opened, InputStream in) {
    if (root != null) {
      root.close();
    }
    if (opened != null) {
      closeRecords(opened);
    } else {
      try {
        in.close();
      } catch (IOException e) {
        logger.error("Error closing {}", dataset, e);
      }
    }
    allocator.close();
  }

  /** Jackson may wrap decoder failures, so the whole cause chain is checked. */
  private static boolean isCodingError(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof CharacterCodingException) {
        return true;
      }
    }
    return false;
  }

  private List<String> columnNames(String[] header, List<String[]> sample) {
    if (options.schema() != null) {
      return ColumnValues.names(options.schema().getFields());
    }
    if (options.columnNames() != null) {
      return options.columnNames();
    }
    if (header != null) {
      List<String> names = new ArrayList<>(header.length);
      for (String name : header) {
        names.add(name.trim());
      }
      return names;
    }
    int width = 0;
    for (String[] row : sample) {
      width = Math.max(width, row.length);
    }
    List<String> names = new ArrayList<>(width);
    for (int i = 0; i < width; i++) {
      names.add("column_" + i);
    }
    return names;
  }

  private Field inputField(String name, int index, List<String[]> sample) {
    if (options.schema() != null) {
      return ColumnValues.normalizedField(name, options.schema().getFields().get(index));
    }
    boolean sawValue = false;
    boolean allLong = true;
    boolean allDouble = true;
    for (String[] row : sample) {
      String cell = index < row.length ? row[index].trim() : "";
      if (cell.isEmpty()) {
        continue;
      }
      sawValue = true;
      if (allLong && parseLong(cell) == null) {
        allLong = false;
      }
      if (allDouble && ColumnValues.parseDouble(cell) == null) {
        allDouble = false;
      }
      if (!allLong && !allDouble) {
        break;
      }
    }
    if (sawValue && allLong) {
      return ColumnValues.int64(name);
    }
    if (sawValue && allDouble) {
      return ColumnValues.float64(name);
    }
    return ColumnValues.field(name, ArrowType.Utf8.INSTANCE);
  }

  private List<String[]> keepRequired(List<String[]> rows) {
    List<String[]> kept = new ArrayList<>(rows.size());
    for (String[] row : rows) {
      String[] cells = new String[fileIndexes.length];
      for (int c = 0; c < fileIndexes.length; c++) {
        int index = fileIndexes[c];
        cells[c] = index < row.length ? row[index] : null;
      }
      kept.add(cells);
    }
    return kept;
  }

  private List<String[]> readRecords(int limit) throws IOException {
    List<String[]> rows = new ArrayList<>();
    while (rows.size() < limit) {
      if (!records.hasNextValue()) {
        exhausted = true;
        break;
      }
      rows.add(stripTrailingDelimiter(records.nextValue()));
      recordsRead++;
    }
    return rows;
  }

  /** Drops the empty cell after a line's trailing delimiter, when the format has one. */
  private String[] stripTrailingDelimiter(String[] record) {
    if (options.trailingDelimiter()
        && record.length > 0
        && record[record.length - 1].isEmpty()) {
      String[] cells = new String[record.length - 1];
      System.arraycopy(record, 0, cells, 0, cells.length);
      return cells;
    }
    return record;
  }

  @Override
  protected VectorSchemaRoot nextInput() throws IOException {
    List<String[]> rows = new ArrayList<>();
    while (rows.size() < batchSize && !pending.isEmpty()) {
      rows.add(pending.poll());
    }
    if (rows.size() < batchSize && !exhausted) {
      rows.addAll(keepRequired(readRecords(batchSize - rows.size())));
    }
    if (rows.isEmpty()) {
      return null;
    }
    fill(rows);
    inputBatches++;
    return inputRoot;
  }

  private void fill(List<String[]> rows) {
    inputRoot.allocateNew();
    List<FieldVector> vectors = inputRoot.getFieldVectors();
    int coerced = 0;
    for (int r = 0; r < rows.size(); r++) {
      String[] cells = rows.get(r);
      for (int c = 0; c < vectors.size(); c++) {
        FieldVector vector = vectors.get(c);
        String raw = cells[c];
        String cell = raw == null ? "" : raw.trim();
        Object value = cell.isEmpty() ? null : convert(vector.getField(), cell);
        if (value == null && !cell.isEmpty()) {
          coerced++;
        }
        ColumnValues.write(vector, r, value);
      }
    }
    inputRoot.setRowCount(rows.size());
    if (coerced > 0) {
      logger.warn(
          "{}: {} values in input batch {} did not fit their column type and were read as null",
          dataset,
          coerced,
          inputBatches);
    }
  }

  private static Object convert(Field field, String cell) {
    switch (field.getType().getTypeID()) {
      case Int:
        return parseLong(cell);
      case FloatingPoint:
        return ColumnValues.parseDouble(cell);
      case Bool:
        if (cell.equalsIgnoreCase("true")) {
          return Boolean.TRUE;
        }
        if (cell.equalsIgnoreCase("false")) {
          return Boolean.FALSE;
        }
        return null;
      default:
        return cell;
    }
  }

  private static Long parseLong(String cell) {
    try {
      return Long.parseLong(cell);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private void closeRecords(MappingIterator<String[]> iterator) {
    try {
      iterator.close();
    } catch (IOException e) {
      logger.error("Error closing {}", dataset, e);
    }
  }

  @Override
  protected void closeInput() {
    inputRoot.close();
    closeRecords(records);
    logger.debug("Read {} records of {}", recordsRead, dataset);
  }
}
