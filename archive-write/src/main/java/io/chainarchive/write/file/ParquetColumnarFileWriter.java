package io.chainarchive.write.file;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.column.ColumnWriteStore;
import org.apache.parquet.column.ParquetProperties;
import org.apache.parquet.hadoop.CodecFactory;
import org.apache.parquet.hadoop.ColumnChunkPageWriteStore;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.io.api.RecordConsumer;
import org.apache.parquet.schema.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chainarchive.Constants;
import io.chainarchive.column.BooleanColumnBuffer;
import io.chainarchive.column.ByteArrayColumnBuffer;
import io.chainarchive.column.ColumnBuffer;
import io.chainarchive.column.Int32ColumnBuffer;
import io.chainarchive.column.Int64ColumnBuffer;
import io.chainarchive.error.SchemaInvariantViolation;
import io.chainarchive.schema.FieldDescriptor;
import io.chainarchive.schema.RecordSchema;

/**
 * Writes row groups of column buffers into one Parquet file. Columns handed over for a row group are staged
 * and checked against the schema, {@link #endRowGroup()} then encodes them record by record into fresh page
 * stores and flushes those into the file.
 */
public class ParquetColumnarFileWriter implements ColumnarFileWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(ParquetColumnarFileWriter.class);
  private final PathOutputFile outputFile;
  private final RecordSchema schema;
  private final MessageType messageType;
  private final ParquetProperties properties;
  private final CodecFactory codecFactory;
  private final CompressionCodecName codecName;
  private final ParquetFileWriter fileWriter;
  private final Map<String, String> footerMetadata = new HashMap<>();

  private ColumnBuffer[] staged;
  private int stagedRows = -1;
  private int rowGroupCount;
  private long rowCount;
  private boolean closed;

  public ParquetColumnarFileWriter(Path path, RecordSchema schema, CompressionCodecName codecName, int pageSize) throws IOException {
    this(new PathOutputFile(path), schema, codecName, pageSize);
  }

  ParquetColumnarFileWriter(PathOutputFile outputFile, RecordSchema schema, CompressionCodecName codecName, int pageSize) throws IOException {
    this.outputFile = outputFile;
    this.schema = schema;
    this.messageType = ParquetSchemaConverter.toMessageType(schema);
    this.codecName = codecName;
    this.properties = ParquetProperties.builder()
        .withWriterVersion(ParquetProperties.WriterVersion.PARQUET_1_0)
        .withPageSize(pageSize)
        .withDictionaryEncoding(true)
        .build();
    this.codecFactory = new CodecFactory(new Configuration(false), pageSize);
    try {
      this.fileWriter = new ParquetFileWriter(outputFile, messageType, ParquetFileWriter.Mode.CREATE,
          ParquetWriter.DEFAULT_BLOCK_SIZE, ParquetWriter.MAX_PADDING_SIZE_DEFAULT);
      this.fileWriter.start();
    } catch (IOException | RuntimeException e) {
      try {
        outputFile.closeStream();
      } catch (IOException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      codecFactory.release();
      throw e;
    }
    LOGGER.info("Opened {} for {} with {} compression", getPath(), schema.getName(), codecName);
  }

  @Override
  public Path getPath() {
    return outputFile.getFilePath();
  }

  @Override
  public RecordSchema getSchema() {
    return schema;
  }

  @Override
  public void startRowGroup(int rows) {
    checkOpen();
    if (staged != null)
      throw new IllegalStateException("Row group already started on " + getPath());
    if (rows <= 0)
      throw new IllegalArgumentException("A row group needs at least one row but got " + rows);
    staged = new ColumnBuffer[schema.numFields()];
    stagedRows = rows;
  }

  @Override
  public void writeColumn(int fieldIndex, ColumnBuffer column) {
    if (staged == null)
      throw new IllegalStateException("No row group started on " + getPath());
    FieldDescriptor field = schema.field(fieldIndex);
    if (column.getPhysicalType() != field.getPhysicalType())
      throw new SchemaInvariantViolation("Column " + field.getName() + " is " + field.getPhysicalType() + " but was handed a " + column.getPhysicalType() + " buffer");
    if (column.size() != stagedRows)
      throw new SchemaInvariantViolation("Column " + field.getName() + " has " + column.size() + " rows but the row group has " + stagedRows);
    if (!field.isOptional() && column.hasNulls())
      throw new SchemaInvariantViolation("Required column " + field.getName() + " has absent rows");
    staged[fieldIndex] = column;
  }

  @Override
  public void endRowGroup() throws IOException {
    if (staged == null)
      throw new IllegalStateException("No row group started on " + getPath());
    for (int i = 0; i < staged.length; i++) {
      if (staged[i] == null)
        throw new SchemaInvariantViolation("Column " + schema.field(i).getName() + " was not written for the row group");
    }
    ColumnChunkPageWriteStore pageStore = new ColumnChunkPageWriteStore(codecFactory.getCompressor(codecName), messageType,
        properties.getAllocator(), properties.getColumnIndexTruncateLength(), properties.getPageWriteChecksumEnabled());
    ColumnWriteStore store = properties.newColumnWriteStore(messageType, pageStore);
    try {
      MessageColumnIO columnIO = new ColumnIOFactory(false).getColumnIO(messageType);
      RecordConsumer consumer = columnIO.getRecordWriter(store);
      writeRecords(consumer);
      consumer.flush();
      fileWriter.startBlock(stagedRows);
      store.flush();
      pageStore.flushToFileWriter(fileWriter);
      fileWriter.endBlock();
    } finally {
      store.close();
    }
    rowGroupCount++;
    rowCount += stagedRows;
    LOGGER.debug("Wrote row group {} of {} rows to {}", rowGroupCount, stagedRows, getPath());
    staged = null;
    stagedRows = -1;
  }

  private void writeRecords(RecordConsumer consumer) {
    List<FieldDescriptor> fields = schema.getFields();
    int[] cursors = new int[staged.length];
    for (int row = 0; row < stagedRows; row++) {
      consumer.startMessage();
      for (int i = 0; i < staged.length; i++) {
        ColumnBuffer column = staged[i];
        if (!column.isPresent(row))
          continue;
        String name = fields.get(i).getName();
        consumer.startField(name, i);
        int dense = cursors[i]++;
        switch (column.getPhysicalType()) {
          case BYTE_ARRAY:
            consumer.addBinary(Binary.fromConstantByteArray(((ByteArrayColumnBuffer) column).getValue(dense)));
            break;
          case INT32:
            consumer.addInteger(((Int32ColumnBuffer) column).getInt(dense));
            break;
          case INT64:
            consumer.addLong(((Int64ColumnBuffer) column).getLong(dense));
            break;
          case BOOLEAN:
            consumer.addBoolean(((BooleanColumnBuffer) column).getBoolean(dense));
            break;
          default:
            throw new SchemaInvariantViolation("No Parquet encoding for " + column.getPhysicalType());
        }
        consumer.endField(name, i);
      }
      consumer.endMessage();
    }
  }

  @Override
  public void putFooterMetadata(String key, String value) {
    footerMetadata.put(key, value);
  }

  @Override
  public int getRowGroupCount() {
    return rowGroupCount;
  }

  @Override
  public long getRowCount() {
    return rowCount;
  }

  @Override
  public void close() throws IOException {
    if (closed)
      return;
    if (staged != null)
      throw new IllegalStateException("Cannot close " + getPath() + " in the middle of a row group");
    closed = true;
    try {
      Map<String, String> extra = new HashMap<>(footerMetadata);
      extra.put(Constants.CREATED_BY_KEY, Constants.CREATED_BY);
      fileWriter.end(extra);
    } finally {
      outputFile.closeStream();
      codecFactory.release();
    }
    LOGGER.info("Closed {} with {} rows in {} row groups", getPath(), rowCount, rowGroupCount);
  }

  @Override
  public void abort() {
    if (closed)
      return;
    closed = true;
    staged = null;
    try {
      outputFile.closeStream();
    } catch (IOException e) {
      LOGGER.warn("Unable to close aborted file {}", getPath(), e);
    }
    codecFactory.release();
  }

  private void checkOpen() {
    if (closed)
      throw new IllegalStateException(getPath() + " is already closed");
  }
}
