package io.chainarchive.schema;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RecordSchemaTest {
  @Test
  public void duplicateFieldsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> RecordSchema.builder("dup")
        .required("id", PhysicalType.BYTE_ARRAY)
        .optional("id", PhysicalType.INT32)
        .build());
  }

  @Test
  public void archiveSchemasKeepDeclaredOrder() {
    RecordSchema call = ArchiveSchemas.forKind(RecordKind.CALL);
    assertEquals("call", call.getName());
    assertEquals(0, call.indexOf("id"));
    assertEquals(1, call.indexOf("parent_id"));
    assertTrue(call.field(1).isOptional());
    assertFalse(call.field(0).isOptional());
    assertEquals(LogicalType.JSON, call.field(call.indexOf("args")).getLogicalType());
    assertEquals(-1, call.indexOf("height"));

    FieldDescriptor timestamp = ArchiveSchemas.BLOCK.field(ArchiveSchemas.BLOCK.indexOf("timestamp"));
    assertEquals(PhysicalType.INT64, timestamp.getPhysicalType());
    assertEquals(LogicalType.TIMESTAMP_MILLIS, timestamp.getLogicalType());
  }

  @Test
  public void recordKindDirectories() {
    assertEquals(RecordKind.EXTRINSIC, RecordKind.fromDirectory("extrinsic"));
    assertEquals("event", RecordKind.EVENT.getDirectory());
    assertEquals(null, RecordKind.fromDirectory("metadata"));
  }
}
