package io.chainarchive.column;

import io.chainarchive.schema.PhysicalType;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;

public class Int64ColumnBuffer extends ColumnBuffer {
  private final LongArrayList values;

  public Int64ColumnBuffer() {
    this.values = new LongArrayList();
  }

  private Int64ColumnBuffer(int expected) {
    this.values = new LongArrayList(expected);
  }

  @Override
  public PhysicalType getPhysicalType() {
    return PhysicalType.INT64;
  }

  public void appendLong(long value) {
    values.add(value);
    markPresent();
  }

  @Override
  protected void appendValue(Object value) {
    values.add(((Long) value).longValue());
  }

  @Override
  protected void copyValue(ColumnBuffer source, int denseIndex) {
    values.add(((Int64ColumnBuffer) source).values.getLong(denseIndex));
  }

  @Override
  protected ColumnBuffer newEmpty(int expectedValues) {
    return new Int64ColumnBuffer(expectedValues);
  }

  @Override
  protected void clearValues() {
    values.clear();
  }

  @Override
  public Long getValue(int denseIndex) {
    return values.getLong(denseIndex);
  }

  public long getLong(int denseIndex) {
    return values.getLong(denseIndex);
  }

  public LongList values() {
    return values;
  }
}
