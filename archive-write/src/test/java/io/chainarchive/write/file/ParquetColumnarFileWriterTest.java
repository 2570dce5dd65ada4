package io.chainarchive.write.file;

import io.chainarchive.Constants;
import io.chainarchive.column.ByteArrayColumnBuffer;
import io.chainarchive.column.ColumnBuffer;
import io.chainarchive.column.Int32ColumnBuffer;
import io.chainarchive.column.Int64ColumnBuffer;
import io.chainarchive.error.SchemaInvariantViolation;
import io.chainarchive.io.Compression;
import io.chainarchive.schema.ArchiveSchemas;
import io.chainarchive.schema.LogicalType;
import io.chainarchive.schema.PhysicalType;
import io.chainarchive.schema.RecordSchema;
import io.chainarchive.write.ParquetTestReader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.PositionOutputStream;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Type.Repetition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ParquetColumnarFileWriterTest {
  private static final RecordSchema SCHEMA = RecordSchema.builder("sample")
      .required("id", PhysicalType.BYTE_ARRAY, LogicalType.STRING)
      .optional("count", PhysicalType.INT32)
      .optional("note", PhysicalType.BYTE_ARRAY, LogicalType.JSON)
      .required("at", PhysicalType.INT64, LogicalType.TIMESTAMP_MILLIS)
      .build();

  private static ColumnBuffer[] columns(int from, int rows) {
    ByteArrayColumnBuffer ids = new ByteArrayColumnBuffer();
    Int32ColumnBuffer counts = new Int32ColumnBuffer();
    ByteArrayColumnBuffer notes = new ByteArrayColumnBuffer();
    Int64ColumnBuffer at = new Int64ColumnBuffer();
    for (int i = from; i < from + rows; i++) {
      ids.appendString("id-" + i);
      if (i % 2 == 0)
        counts.appendInt(i);
      else
        counts.appendNull();
      if (i % 3 == 0)
        notes.appendString("{\"i\":" + i + "}");
      else
        notes.appendNull();
      at.appendLong(1000L * i);
    }
    return new ColumnBuffer[] {ids, counts, notes, at};
  }

  private static void writeRowGroup(ColumnarFileWriter writer, ColumnBuffer[] columns) throws Exception {
    writer.startRowGroup(columns[0].size());
    for (int i = 0; i < columns.length; i++)
      writer.writeColumn(i, columns[i]);
    writer.endRowGroup();
  }

  @Test
  public void absentValuesRoundTrip(@TempDir Path dir) throws Exception {
    Path path = dir.resolve("sample.parquet");
    ColumnarFileWriter writer = new ParquetColumnarFileWriterFactory(Compression.NONE).open(path, SCHEMA);
    writeRowGroup(writer, columns(0, 5));
    writeRowGroup(writer, columns(5, 3));
    writer.putFooterMetadata(Constants.RECORD_KIND_KEY, "sample");
    writer.close();
    assertEquals(2, writer.getRowGroupCount());
    assertEquals(8, writer.getRowCount());

    assertEquals(java.util.Arrays.asList(5L, 3L), ParquetTestReader.rowGroupSizes(path));
    List<Group> rows = ParquetTestReader.readRows(path);
    assertEquals(8, rows.size());
    for (int i = 0; i < 8; i++) {
      Group row = rows.get(i);
      assertEquals("id-" + i, row.getString("id", 0));
      if (i % 2 == 0)
        assertEquals(i, row.getInteger("count", 0));
      else
        assertTrue(ParquetTestReader.isAbsent(row, "count"));
      if (i % 3 == 0)
        assertEquals("{\"i\":" + i + "}", row.getString("note", 0));
      else
        assertTrue(ParquetTestReader.isAbsent(row, "note"));
      assertEquals(1000L * i, row.getLong("at", 0));
    }
    assertEquals("sample", ParquetTestReader.footerMetadata(path).get(Constants.RECORD_KIND_KEY));
    assertEquals(Constants.CREATED_BY, ParquetTestReader.footerMetadata(path).get(Constants.CREATED_BY_KEY));
  }

  @Test
  public void compressedFilesReadBack(@TempDir Path dir) throws Exception {
    Path path = dir.resolve("zstd.parquet");
    ColumnarFileWriter writer = new ParquetColumnarFileWriterFactory(Compression.ZSTD).open(path, SCHEMA);
    writeRowGroup(writer, columns(0, 100));
    writer.close();
    List<Group> rows = ParquetTestReader.readRows(path);
    assertEquals(100, rows.size());
    assertEquals("id-99", rows.get(99).getString("id", 0));
  }

  @Test
  public void mismatchedColumnsAreRejected(@TempDir Path dir) throws Exception {
    ColumnarFileWriter writer = new ParquetColumnarFileWriterFactory(Compression.NONE).open(dir.resolve("bad.parquet"), SCHEMA);
    ColumnBuffer[] columns = columns(0, 4);
    writer.startRowGroup(4);
    // an INT64 buffer where an INT32 column is declared
    assertThrows(SchemaInvariantViolation.class, () -> writer.writeColumn(1, columns[3]));
    // row count differs from the row group
    assertThrows(SchemaInvariantViolation.class, () -> writer.writeColumn(0, columns(0, 3)[0]));
    ByteArrayColumnBuffer withNull = new ByteArrayColumnBuffer();
    withNull.appendString("a");
    withNull.appendNull();
    withNull.appendString("c");
    withNull.appendString("d");
    // required column with an absent row
    assertThrows(SchemaInvariantViolation.class, () -> writer.writeColumn(0, withNull));
    writer.writeColumn(0, columns[0]);
    // not every column written
    assertThrows(SchemaInvariantViolation.class, writer::endRowGroup);
    writer.abort();
  }

  @Test
  public void schemaConversion() {
    MessageType message = ParquetSchemaConverter.toMessageType(ArchiveSchemas.BLOCK);
    assertEquals("block", message.getName());
    assertEquals(ArchiveSchemas.BLOCK.numFields(), message.getFieldCount());
    assertEquals(PrimitiveTypeName.INT32, message.getType("height").asPrimitiveType().getPrimitiveTypeName());
    assertEquals(Repetition.OPTIONAL, message.getType("validator").getRepetition());
    assertEquals(Repetition.REQUIRED, message.getType("id").getRepetition());
    assertEquals(LogicalTypeAnnotation.stringType(), message.getType("hash").getLogicalTypeAnnotation());
    assertEquals(LogicalTypeAnnotation.timestampType(true, LogicalTypeAnnotation.TimeUnit.MILLIS),
        message.getType("timestamp").getLogicalTypeAnnotation());
    assertEquals(LogicalTypeAnnotation.jsonType(),
        ParquetSchemaConverter.toMessageType(ArchiveSchemas.CALL).getType("args").getLogicalTypeAnnotation());
  }

  @Test
  public void failedOpenReleasesTheStream(@TempDir Path dir) {
    AtomicInteger closes = new AtomicInteger();
    PathOutputFile failing = new PathOutputFile(dir.resolve("broken.parquet")) {
      @Override
      public PositionOutputStream create(long blockSizeHint) throws IOException {
        super.create(blockSizeHint);
        throw new IOException("disk full");
      }

      @Override
      void closeStream() throws IOException {
        closes.incrementAndGet();
        super.closeStream();
      }
    };
    assertThrows(IOException.class,
        () -> new ParquetColumnarFileWriter(failing, SCHEMA, CompressionCodecName.UNCOMPRESSED, 64 * 1024));
    assertEquals(1, closes.get());
  }
}
