package io.chainarchive.write.file;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

import io.chainarchive.column.ColumnBuffer;
import io.chainarchive.schema.RecordSchema;

/**
 * One open columnar file. Row groups are written as a {@link #startRowGroup(int)}, one
 * {@link #writeColumn(int, ColumnBuffer)} per schema field, {@link #endRowGroup()} sequence and
 * {@link #close()} writes the footer.
 */
public interface ColumnarFileWriter extends Closeable {
  Path getPath();

  RecordSchema getSchema();

  void startRowGroup(int rows) throws IOException;

  /**
   * @param fieldIndex Position of the field in the schema.
   * @param column     Dense values plus presence, exactly as many rows as the row group declared.
   */
  void writeColumn(int fieldIndex, ColumnBuffer column) throws IOException;

  void endRowGroup() throws IOException;

  /**
   * Adds a key value pair to the footer written on {@link #close()}.
   */
  void putFooterMetadata(String key, String value);

  int getRowGroupCount();

  long getRowCount();

  /**
   * Releases the file without writing a footer, the partial file is left behind.
   */
  void abort();
}
