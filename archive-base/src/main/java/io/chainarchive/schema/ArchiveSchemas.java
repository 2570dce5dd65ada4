package io.chainarchive.schema;

import static io.chainarchive.schema.LogicalType.JSON;
import static io.chainarchive.schema.LogicalType.STRING;
import static io.chainarchive.schema.LogicalType.TIMESTAMP_MILLIS;
import static io.chainarchive.schema.PhysicalType.BOOLEAN;
import static io.chainarchive.schema.PhysicalType.BYTE_ARRAY;
import static io.chainarchive.schema.PhysicalType.INT32;
import static io.chainarchive.schema.PhysicalType.INT64;

/**
 * Physical schemas of the four archived record kinds.
 */
public final class ArchiveSchemas {
  public static final RecordSchema BLOCK = RecordSchema.builder("block")
      .required("id", BYTE_ARRAY, STRING)
      .required("height", INT32)
      .required("hash", BYTE_ARRAY, STRING)
      .required("parent_hash", BYTE_ARRAY, STRING)
      .optional("state_root", BYTE_ARRAY, STRING)
      .optional("extrinsics_root", BYTE_ARRAY, STRING)
      .required("timestamp", INT64, TIMESTAMP_MILLIS)
      .optional("spec_id", BYTE_ARRAY, STRING)
      .optional("validator", BYTE_ARRAY, STRING)
      .build();

  public static final RecordSchema EXTRINSIC = RecordSchema.builder("extrinsic")
      .required("id", BYTE_ARRAY, STRING)
      .required("block_id", BYTE_ARRAY, STRING)
      .required("index_in_block", INT32)
      .optional("version", INT32)
      .optional("signature", BYTE_ARRAY, JSON)
      .required("call_id", BYTE_ARRAY, STRING)
      .optional("fee", INT64)
      .optional("tip", INT64)
      .required("success", BOOLEAN)
      .optional("error", BYTE_ARRAY, JSON)
      .required("hash", BYTE_ARRAY, STRING)
      .optional("pos", INT32)
      .build();

  public static final RecordSchema EVENT = RecordSchema.builder("event")
      .required("id", BYTE_ARRAY, STRING)
      .required("block_id", BYTE_ARRAY, STRING)
      .required("index_in_block", INT32)
      .required("phase", BYTE_ARRAY, STRING)
      .optional("extrinsic_id", BYTE_ARRAY, STRING)
      .optional("call_id", BYTE_ARRAY, STRING)
      .required("name", BYTE_ARRAY, STRING)
      .optional("args", BYTE_ARRAY, JSON)
      .optional("pos", INT32)
      .build();

  public static final RecordSchema CALL = RecordSchema.builder("call")
      .required("id", BYTE_ARRAY, STRING)
      .optional("parent_id", BYTE_ARRAY, STRING)
      .required("block_id", BYTE_ARRAY, STRING)
      .required("extrinsic_id", BYTE_ARRAY, STRING)
      .required("success", BOOLEAN)
      .optional("error", BYTE_ARRAY, JSON)
      .optional("origin", BYTE_ARRAY, JSON)
      .required("name", BYTE_ARRAY, STRING)
      .optional("args", BYTE_ARRAY, JSON)
      .optional("pos", INT32)
      .build();

  private ArchiveSchemas() {
  }

  public static RecordSchema forKind(RecordKind kind) {
    switch (kind) {
      case BLOCK:
        return BLOCK;
      case EXTRINSIC:
        return EXTRINSIC;
      case EVENT:
        return EVENT;
      case CALL:
        return CALL;
    }
    throw new IllegalStateException("unknown record kind " + kind);
  }
}
