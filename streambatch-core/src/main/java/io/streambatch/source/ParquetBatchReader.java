package io.streambatch.source;

import io.streambatch.ColumnValues;
import io.streambatch.FormatUnsupportedException;
import io.streambatch.RowPredicate;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.channels.SeekableByteChannel;
import java.util.ArrayList;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.RecordReader;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a Parquet file one row group at a time.
 *
 * <p>Only the column chunks of projected and filtered columns are fetched. Flat columns are
 * normalized: INT32 and INT64 to Int64, FLOAT and DOUBLE to Float64, decimals to Float64, BOOLEAN
 * to Bool and BINARY to Utf8. Nested, repeated, INT96 and fixed-length non-decimal columns are
 * listed in the schema but fail with {@link FormatUnsupportedException} when requested.
 */
final class ParquetBatchReader extends ProjectingBatchReader {
  private static final Logger logger = LoggerFactory.getLogger(ParquetBatchReader.class);
  private static final ArrowType INT64 = new ArrowType.Int(64, true);
  private static final ArrowType FLOAT64 =
      new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);

  private final SeekableByteChannel channel;
  private final ParquetFileReader reader;
  private final List<BlockMetaData> rowGroups;
  private final MessageType requestedSchema;
  private final MessageColumnIO columnIO;
  private final PrimitiveType[] columnTypes;
  private final VectorSchemaRoot inputRoot;
  private int nextRowGroup;

  /**
   * Opens the file and reads its footer. The channel is owned by the reader from here on and
   * closed even if opening fails.
   */
  ParquetBatchReader(
      String dataset,
      SeekableByteChannel channel,
      BufferAllocator parent,
      int batchSize,
      List<String> columns,
      RowPredicate filter,
      Runnable onClose) {
    super(
        dataset,
        parent.newChildAllocator("parquet:" + dataset, 0, Long.MAX_VALUE),
        batchSize,
        onClose);
    this.channel = channel;
    ParquetFileReader opened = null;
    VectorSchemaRoot root = null;
    try {
      opened = openFile(dataset, channel);
      this.reader = opened;
      this.rowGroups = opened.getRowGroups();
      MessageType fileSchema = opened.getFooter().getFileMetaData().getSchema();

      List<Field> fileFields = new ArrayList<>(fileSchema.getFieldCount());
      for (Type type : fileSchema.getFields()) {
        ArrowType arrowType = arrowType(type);
        fileFields.add(
            ColumnValues.field(
                type.getName(), arrowType == null ? ArrowType.Utf8.INSTANCE : arrowType));
      }
      List<String> required = requiredColumns(columns, filter);
      List<Field> requiredFields = project(dataset, new Schema(fileFields), required);

      List<Type> requestedTypes = new ArrayList<>(requiredFields.size());
      List<Field> inputFields = new ArrayList<>(requiredFields.size());
      this.columnTypes = new PrimitiveType[requiredFields.size()];
      for (int c = 0; c < requiredFields.size(); c++) {
        String name = requiredFields.get(c).getName();
        Type type = fileSchema.getType(name);
        ArrowType arrowType = arrowType(type);
        if (arrowType == null) {
          throw new FormatUnsupportedException(
              "Column " + name + " of " + dataset + " has unsupported Parquet type " + type);
        }
        requestedTypes.add(type);
        columnTypes[c] = type.asPrimitiveType();
        inputFields.add(ColumnValues.field(name, arrowType));
      }
      if (requestedTypes.isEmpty()) {
        this.requestedSchema = null;
        this.columnIO = null;
      } else {
        this.requestedSchema = new MessageType(fileSchema.getName(), requestedTypes);
        opened.setRequestedSchema(requestedSchema);
        this.columnIO = new ColumnIOFactory().getColumnIO(requestedSchema, fileSchema);
      }
      Schema inputSchema = new Schema(inputFields);
      root = VectorSchemaRoot.create(inputSchema, allocator);
      this.inputRoot = root;
      bind(inputSchema, columns, filter);
    } catch (RuntimeException e) {
      release(opened, root);
      throw e;
    }
    logger.debug(
        "Opened {} with {} row groups, reading columns {}",
        dataset,
        rowGroups.size(),
        ColumnValues.names(inputRoot.getSchema().getFields()));
  }

  /** Parquet reports a bad footer or magic number as an unchecked exception. */
  private static ParquetFileReader openFile(String dataset, SeekableByteChannel channel) {
    try {
      return ParquetFileReader.open(new ChannelInputFile(channel));
    } catch (IOException | RuntimeException e) {
      throw new FormatUnsupportedException("Not a readable Parquet file: " + dataset, e);
    }
  }

  /** Normalized Arrow type of a top-level Parquet column, or null if it cannot be read. */
  private static ArrowType arrowType(Type type) {
    if (!type.isPrimitive() || type.isRepetition(Type.Repetition.REPEATED)) {
      return null;
    }
    PrimitiveType primitive = type.asPrimitiveType();
    if (primitive.getLogicalTypeAnnotation()
        instanceof LogicalTypeAnnotation.DecimalLogicalTypeAnnotation) {
      return FLOAT64;
    }
    switch (primitive.getPrimitiveTypeName()) {
      case BOOLEAN:
        return ArrowType.Bool.INSTANCE;
      case INT32:
      case INT64:
        return INT64;
      case FLOAT:
      case DOUBLE:
        return FLOAT64;
      case BINARY:
        return ArrowType.Utf8.INSTANCE;
      default:
        return null;
    }
  }

  private void release(ParquetFileReader opened, VectorSchemaRoot root) {
    if (root != null) {
      root.close();
    }
    closeFile(opened);
    allocator.close();
  }

  /** Closing the reader closes its stream, and with it the channel. */
  private void closeFile(ParquetFileReader opened) {
    try {
      if (opened != null) {
        opened.close();
      } else {
        channel.close();
      }
    } catch (IOException e) {
      logger.error("Error closing {}", dataset, e);
    }
  }

  @Override
  protected VectorSchemaRoot nextInput() throws IOException {
    if (nextRowGroup >= rowGroups.size()) {
      return null;
    }
    int rows = Math.toIntExact(rowGroups.get(nextRowGroup).getRowCount());
    nextRowGroup++;
    if (columnIO == null) {
      // nothing to decode; only the row count is needed
      reader.skipNextRowGroup();
      inputRoot.setRowCount(rows);
      return inputRoot;
    }
    PageReadStore pages = reader.readNextRowGroup();
    if (pages == null) {
      return null;
    }
    RecordReader<Group> records =
        columnIO.getRecordReader(pages, new GroupRecordConverter(requestedSchema));
    inputRoot.allocateNew();
    List<FieldVector> vectors = inputRoot.getFieldVectors();
    for (int row = 0; row < rows; row++) {
      Group group = records.read();
      for (int c = 0; c < vectors.size(); c++) {
        ColumnValues.write(vectors.get(c), row, value(group, c, columnTypes[c]));
      }
    }
    inputRoot.setRowCount(rows);
    return inputRoot;
  }

  private static Object value(Group group, int field, PrimitiveType type) {
    if (group.getFieldRepetitionCount(field) == 0) {
      return null;
    }
    LogicalTypeAnnotation annotation = type.getLogicalTypeAnnotation();
    int scale =
        annotation instanceof LogicalTypeAnnotation.DecimalLogicalTypeAnnotation
            ? ((LogicalTypeAnnotation.DecimalLogicalTypeAnnotation) annotation).getScale()
            : -1;
    switch (type.getPrimitiveTypeName()) {
      case BOOLEAN:
        return group.getBoolean(field, 0);
      case INT32:
        int intValue = group.getInteger(field, 0);
        return scale >= 0 ? BigDecimal.valueOf(intValue, scale).doubleValue() : (long) intValue;
      case INT64:
        long longValue = group.getLong(field, 0);
        return scale >= 0 ? BigDecimal.valueOf(longValue, scale).doubleValue() : longValue;
      case FLOAT:
        return (double) group.getFloat(field, 0);
      case DOUBLE:
        return group.getDouble(field, 0);
      case BINARY:
      case FIXED_LEN_BYTE_ARRAY:
        if (scale >= 0) {
          byte[] unscaled = group.getBinary(field, 0).getBytes();
          return new BigDecimal(new BigInteger(unscaled), scale).doubleValue();
        }
        return group.getBinary(field, 0).toStringUsingUTF8();
      default:
        throw new IllegalStateException("Unreadable column type " + type);
    }
  }

  @Override
  protected void closeInput() {
    inputRoot.close();
    closeFile(reader);
    logger.debug("Read {} of {} row groups of {}", nextRowGroup, rowGroups.size(), dataset);
  }
}
