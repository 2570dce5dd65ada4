package io.chainarchive.column;

import java.nio.charset.StandardCharsets;

import io.chainarchive.schema.PhysicalType;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectList;

/**
 * Variable length byte strings. Strings are stored as their UTF-8 bytes.
 */
public class ByteArrayColumnBuffer extends ColumnBuffer {
  private final ObjectArrayList<byte[]> values;
  private long byteSize;

  public ByteArrayColumnBuffer() {
    this.values = new ObjectArrayList<>();
  }

  private ByteArrayColumnBuffer(int expected) {
    this.values = new ObjectArrayList<>(expected);
  }

  @Override
  public PhysicalType getPhysicalType() {
    return PhysicalType.BYTE_ARRAY;
  }

  public void appendBytes(byte[] value) {
    if (value == null) {
      appendNull();
      return;
    }
    values.add(value);
    byteSize += value.length;
    markPresent();
  }

  public void appendString(String value) {
    appendBytes(value == null ? null : value.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  protected void appendValue(Object value) {
    byte[] bytes = (byte[]) value;
    values.add(bytes);
    byteSize += bytes.length;
  }

  @Override
  protected void copyValue(ColumnBuffer source, int denseIndex) {
    byte[] bytes = ((ByteArrayColumnBuffer) source).values.get(denseIndex);
    values.add(bytes);
    byteSize += bytes.length;
  }

  @Override
  protected ColumnBuffer newEmpty(int expectedValues) {
    return new ByteArrayColumnBuffer(expectedValues);
  }

  @Override
  protected void clearValues() {
    values.clear();
    byteSize = 0;
  }

  @Override
  public byte[] getValue(int denseIndex) {
    return values.get(denseIndex);
  }

  public String getString(int denseIndex) {
    return new String(values.get(denseIndex), StandardCharsets.UTF_8);
  }

  /**
   * @return Total bytes held by present values.
   */
  public long byteSize() {
    return byteSize;
  }

  public ObjectList<byte[]> values() {
    return values;
  }
}
