package io.chainarchive.schema;

/**
 * Annotation on top of a {@link PhysicalType}, it never changes how values are encoded.
 */
public enum LogicalType {
  NONE,
  STRING,
  JSON,
  TIMESTAMP_MILLIS
}
