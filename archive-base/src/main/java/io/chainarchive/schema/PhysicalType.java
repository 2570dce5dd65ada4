package io.chainarchive.schema;

/**
 * The closed set of storable encodings. Textual and JSON values are stored as {@link #BYTE_ARRAY}.
 */
public enum PhysicalType {
  BYTE_ARRAY("BA", byte[].class),
  INT32("I", Integer.class),
  INT64("L", Long.class),
  BOOLEAN("B", Boolean.class);

  private final String code;
  private final Class<?> valueClass;

  PhysicalType(String code, Class<?> valueClass) {
    this.code = code;
    this.valueClass = valueClass;
  }

  public static PhysicalType getPhysicalType(String code) {
    for (PhysicalType pt : PhysicalType.values()) {
      if (pt.getCode().equals(code))
        return pt;
    }
    return null;
  }

  public String getCode() {
    return code;
  }

  /**
   * The boxed java class a column of this type accepts on append.
   *
   * @return The value class.
   */
  public Class<?> valueClass() {
    return valueClass;
  }

  public boolean accepts(Object value) {
    return value == null || valueClass.isInstance(value);
  }
}
