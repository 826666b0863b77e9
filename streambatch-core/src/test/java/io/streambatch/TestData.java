package io.streambatch;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.arrow.compression.CommonsCompressionFactory;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.ipc.ArrowFileReader;
import org.apache.arrow.vector.ipc.ArrowFileWriter;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.MessageTypeParser;
import org.apache.parquet.schema.Type;

/**
 * Fixture helpers: write Arrow IPC and Parquet files row by row and read columns back as Java
 * values.
 */
public final class TestData {

  private TestData() {}

  public static Field int64(String name) {
    return ColumnValues.int64(name);
  }

  public static Field float64(String name) {
    return ColumnValues.float64(name);
  }

  public static Field utf8(String name) {
    return ColumnValues.field(name, ArrowType.Utf8.INSTANCE);
  }

  public static Schema schema(Field... fields) {
    return new Schema(Arrays.asList(fields));
  }

  /** One row as an array of normalized values. */
  public static Object[] row(Object... values) {
    return values;
  }

  /** One batch as a list of rows. */
  public static List<Object[]> batch(Object[]... rows) {
    return Arrays.asList(rows);
  }

  /**
   * Writes an Arrow IPC file with one record batch per entry of {@code batches}.
   *
   * @param file target file
   * @param allocator allocator for the temporary root
   * @param schema columns of Int64, Float64, Bool or Utf8 type
   * @param batches rows per record batch
   */
  public static Path writeArrow(
      Path file, BufferAllocator allocator, Schema schema, List<List<Object[]>> batches)
      throws IOException {
    try (VectorSchemaRoot root = VectorSchemaRoot.create(schema, allocator);
        FileChannel channel =
            FileChannel.open(
                file,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        ArrowFileWriter writer =
            new ArrowFileWriter(root, new DictionaryProvider.MapDictionaryProvider(), channel)) {
      writer.start();
      for (List<Object[]> rows : batches) {
        root.allocateNew();
        List<FieldVector> vectors = root.getFieldVectors();
        for (int r = 0; r < rows.size(); r++) {
          for (int c = 0; c < vectors.size(); c++) {
            ColumnValues.write(vectors.get(c), r, rows.get(r)[c]);
          }
        }
        root.setRowCount(rows.size());
        writer.writeBatch();
      }
      writer.end();
    }
    return file;
  }

  /** Writes a single Int64 column, one record batch per array. */
  public static Path writeLongs(
      Path file, BufferAllocator allocator, String column, Long[]... batches) throws IOException {
    List<List<Object[]>> all = new ArrayList<>();
    for (Long[] values : batches) {
      List<Object[]> rows = new ArrayList<>();
      for (Long value : values) {
        rows.add(new Object[] {value});
      }
      all.add(rows);
    }
    return writeArrow(file, allocator, schema(int64(column)), all);
  }

  /** Values of one column of a root, normalized. */
  public static List<Object> column(VectorSchemaRoot root, String name) {
    FieldVector vector = root.getVector(name);
    List<Object> values = new ArrayList<>(root.getRowCount());
    for (int row = 0; row < root.getRowCount(); row++) {
      values.add(ColumnValues.read(vector, row));
    }
    return values;
  }

  /** Values of one column across every record batch of an Arrow IPC file. */
  public static List<Object> readColumn(Path file, BufferAllocator allocator, String name)
      throws IOException {
    List<Object> values = new ArrayList<>();
    try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ);
        ArrowFileReader reader =
            new ArrowFileReader(channel, allocator, CommonsCompressionFactory.INSTANCE)) {
      while (reader.loadNextBatch()) {
        values.addAll(column(reader.getVectorSchemaRoot(), name));
      }
    }
    return values;
  }

  /** Values of one column across every batch of a reader, consuming it. */
  public static List<Object> drain(RecordBatchReader reader, String name) {
    List<Object> values = new ArrayList<>();
    while (reader.loadNextBatch()) {
      values.addAll(column(reader.getVectorSchemaRoot(), name));
    }
    return values;
  }

  /**
   * Writes an uncompressed Parquet file. Null cells are left unset, so their columns must be
   * optional.
   *
   * @param file target file
   * @param messageType Parquet schema, e.g. {@code message m { optional int64 id; }}
   * @param rowGroupBytes row group size threshold; small values yield several row groups
   * @param rows cell values in schema order: numbers, booleans or strings
   */
  public static Path writeParquet(
      Path file, String messageType, int rowGroupBytes, List<Object[]> rows) throws IOException {
    MessageType schema = MessageTypeParser.parseMessageType(messageType);
    SimpleGroupFactory groups = new SimpleGroupFactory(schema);
    try (ParquetWriter<Group> writer =
        ExampleParquetWriter.builder(new LocalOutputFile(file))
            .withType(schema)
            .withCompressionCodec(CompressionCodecName.UNCOMPRESSED)
            .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
            .withRowGroupSize(rowGroupBytes)
            .build()) {
      for (Object[] row : rows) {
        Group group = groups.newGroup();
        for (int c = 0; c < row.length; c++) {
          if (row[c] != null) {
            append(group, schema.getType(c), row[c]);
          }
        }
        writer.write(group);
      }
    }
    return file;
  }

  private static void append(Group group, Type type, Object value) {
    String name = type.getName();
    switch (type.asPrimitiveType().getPrimitiveTypeName()) {
      case INT32:
        group.append(name, ((Number) value).intValue());
        break;
      case INT64:
        group.append(name, ((Number) value).longValue());
        break;
      case FLOAT:
        group.append(name, ((Number) value).floatValue());
        break;
      case DOUBLE:
        group.append(name, ((Number) value).doubleValue());
        break;
      case BOOLEAN:
        group.append(name, (Boolean) value);
        break;
      default:
        group.append(name, value.toString());
        break;
    }
  }

  /** Parquet output straight to a local file, without a Hadoop file system. */
  private static final class LocalOutputFile implements OutputFile {
    private final Path file;

    LocalOutputFile(Path file) {
      this.file = file;
    }

    @Override
    public PositionOutputStream create(long blockSizeHint) throws IOException {
      return open(Files.newOutputStream(file, StandardOpenOption.CREATE_NEW));
    }

    @Override
    public PositionOutputStream createOrOverwrite(long blockSizeHint) throws IOException {
      return open(Files.newOutputStream(file));
    }

    private static PositionOutputStream open(OutputStream out) {
      BufferedOutputStream buffered = new BufferedOutputStream(out);
      return new PositionOutputStream() {
        private long position;

        @Override
        public long getPos() {
          return position;
        }

        @Override
        public void write(int b) throws IOException {
          buffered.write(b);
          position++;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
          buffered.write(b, off, len);
          position += len;
        }

        @Override
        public void flush() throws IOException {
          buffered.flush();
        }

        @Override
        public void close() throws IOException {
          buffered.close();
        }
      };
    }

    @Override
    public boolean supportsBlockSize() {
      return false;
    }

    @Override
    public long defaultBlockSize() {
      return 0;
    }
  }
}
