package io.chainarchive.write.batch;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

import io.chainarchive.column.ColumnBuffer;
import io.chainarchive.column.ColumnBuffers;
import io.chainarchive.decode.ArchiveDecoder;
import io.chainarchive.error.EncodingException;
import io.chainarchive.error.SchemaInvariantViolation;
import io.chainarchive.schema.FieldDescriptor;
import io.chainarchive.schema.RecordKind;
import io.chainarchive.schema.RecordSchema;

/**
 * Owns one column buffer per schema field. A push first extracts a whole row, then checks it against the schema
 * and only then appends, so a record that fails leaves every column as it was.
 */
public abstract class AbstractRecordBatch<R> implements RecordBatch<R> {
  private final RecordKind kind;
  private final RecordSchema schema;
  protected final List<ColumnBuffer> columns;
  private int rows;

  protected AbstractRecordBatch(RecordKind kind, RecordSchema schema) {
    this.kind = kind;
    this.schema = schema;
    this.columns = ColumnBuffers.forSchema(schema);
  }

  @Override
  public RecordKind kind() {
    return kind;
  }

  @Override
  public RecordSchema schema() {
    return schema;
  }

  /**
   * Fills {@code row} with the record's values in schema order, {@code null} for absent values.
   */
  protected abstract void extract(R record, Object[] row);

  /**
   * @return The permutation applied to all columns before they are handed out.
   */
  protected abstract int[] sortPermutation();

  @Override
  public int push(R record) {
    if (record == null)
      throw new EncodingException(null, "Cannot push a missing " + kind.getDirectory() + " record");
    Object[] row = new Object[schema.numFields()];
    extract(record, row);
    for (int i = 0; i < row.length; i++) {
      FieldDescriptor field = schema.field(i);
      if (row[i] == null) {
        if (!field.isOptional())
          throw new EncodingException(field.getName(), "Required field " + field.getName() + " is missing on " + record);
      } else if (!field.getPhysicalType().accepts(row[i])) {
        throw new SchemaInvariantViolation("Field " + field.getName() + " expects " + field.getPhysicalType() + " but got " + row[i].getClass().getName());
      }
    }
    for (int i = 0; i < row.length; i++)
      columns.get(i).append(row[i]);
    return ++rows;
  }

  @Override
  public List<ColumnBuffer> sortedColumns() {
    if (rows == 0)
      return Collections.unmodifiableList(new ArrayList<>(columns));
    int[] permutation = sortPermutation();
    List<ColumnBuffer> sorted = new ArrayList<>(columns.size());
    for (ColumnBuffer column : columns)
      sorted.add(column.permute(permutation));
    return Collections.unmodifiableList(sorted);
  }

  @Override
  public int size() {
    return rows;
  }

  @Override
  public void reset() {
    for (ColumnBuffer column : columns)
      column.clear();
    rows = 0;
  }

  protected ColumnBuffer column(String name) {
    int index = schema.indexOf(name);
    if (index < 0)
      throw new IllegalArgumentException("No field " + name + " in " + schema.getName());
    return columns.get(index);
  }

  protected static byte[] text(String value) {
    return value == null ? null : value.getBytes(StandardCharsets.UTF_8);
  }

  protected static byte[] json(String field, JsonNode value) {
    return text(ArchiveDecoder.toJsonText(field, value));
  }
}
