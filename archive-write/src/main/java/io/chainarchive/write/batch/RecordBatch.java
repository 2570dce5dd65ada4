package io.chainarchive.write.batch;

import java.util.List;

import io.chainarchive.column.ColumnBuffer;
import io.chainarchive.schema.RecordKind;
import io.chainarchive.schema.RecordSchema;

/**
 * Accumulates the rows of one record kind column by column until they are written as a row group.
 *
 * @param <R> The record type.
 */
public interface RecordBatch<R> {
  RecordKind kind();

  RecordSchema schema();

  /**
   * Appends one record to every column, either all of them or none.
   *
   * @param record The record.
   *
   * @return The number of rows held after the push.
   */
  int push(R record);

  /**
   * @return The columns in schema order, all permuted by the batch's sort key.
   */
  List<ColumnBuffer> sortedColumns();

  int size();

  void reset();

  /**
   * @param record The record.
   *
   * @return The height of the block the record belongs to.
   */
  long blockHeight(R record);
}
