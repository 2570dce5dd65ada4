package io.chainarchive.column;

import java.util.ArrayList;
import java.util.List;

import io.chainarchive.schema.FieldDescriptor;
import io.chainarchive.schema.PhysicalType;
import io.chainarchive.schema.RecordSchema;

public final class ColumnBuffers {
  private ColumnBuffers() {
  }

  public static ColumnBuffer create(PhysicalType physicalType) {
    switch (physicalType) {
      case BYTE_ARRAY:
        return new ByteArrayColumnBuffer();
      case INT32:
        return new Int32ColumnBuffer();
      case INT64:
        return new Int64ColumnBuffer();
      case BOOLEAN:
        return new BooleanColumnBuffer();
    }
    throw new IllegalStateException("unknown physical type " + physicalType);
  }

  /**
   * @param schema The record schema.
   *
   * @return One empty buffer per field, in schema order.
   */
  public static List<ColumnBuffer> forSchema(RecordSchema schema) {
    List<ColumnBuffer> buffers = new ArrayList<>(schema.numFields());
    for (FieldDescriptor field : schema.getFields())
      buffers.add(create(field.getPhysicalType()));
    return buffers;
  }
}
