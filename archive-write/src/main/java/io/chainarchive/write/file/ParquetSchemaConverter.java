package io.chainarchive.write.file;

import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Type.Repetition;
import org.apache.parquet.schema.Types;

import io.chainarchive.schema.FieldDescriptor;
import io.chainarchive.schema.LogicalType;
import io.chainarchive.schema.PhysicalType;
import io.chainarchive.schema.RecordSchema;

/**
 * Maps a {@link RecordSchema} to a flat Parquet message.
 */
public final class ParquetSchemaConverter {
  private ParquetSchemaConverter() {
  }

  public static MessageType toMessageType(RecordSchema schema) {
    Types.MessageTypeBuilder builder = Types.buildMessage();
    for (FieldDescriptor field : schema.getFields())
      builder.addField(toPrimitiveType(field));
    return builder.named(schema.getName());
  }

  public static PrimitiveType toPrimitiveType(FieldDescriptor field) {
    Repetition repetition = field.isOptional() ? Repetition.OPTIONAL : Repetition.REQUIRED;
    Types.PrimitiveBuilder<PrimitiveType> builder = Types.primitive(primitiveTypeName(field.getPhysicalType()), repetition);
    LogicalTypeAnnotation annotation = annotation(field.getLogicalType());
    if (annotation != null)
      builder = builder.as(annotation);
    return builder.named(field.getName());
  }

  static PrimitiveTypeName primitiveTypeName(PhysicalType physicalType) {
    switch (physicalType) {
      case BYTE_ARRAY:
        return PrimitiveTypeName.BINARY;
      case INT32:
        return PrimitiveTypeName.INT32;
      case INT64:
        return PrimitiveTypeName.INT64;
      case BOOLEAN:
        return PrimitiveTypeName.BOOLEAN;
    }
    throw new IllegalStateException("unknown physical type " + physicalType);
  }

  static LogicalTypeAnnotation annotation(LogicalType logicalType) {
    switch (logicalType) {
      case NONE:
        return null;
      case STRING:
        return LogicalTypeAnnotation.stringType();
      case JSON:
        return LogicalTypeAnnotation.jsonType();
      case TIMESTAMP_MILLIS:
        return LogicalTypeAnnotation.timestampType(true, LogicalTypeAnnotation.TimeUnit.MILLIS);
    }
    throw new IllegalStateException("unknown logical type " + logicalType);
  }
}
