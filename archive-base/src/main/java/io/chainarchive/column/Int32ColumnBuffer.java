package io.chainarchive.column;

import io.chainarchive.schema.PhysicalType;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

public class Int32ColumnBuffer extends ColumnBuffer {
  private final IntArrayList values;

  public Int32ColumnBuffer() {
    this.values = new IntArrayList();
  }

  private Int32ColumnBuffer(int expected) {
    this.values = new IntArrayList(expected);
  }

  @Override
  public PhysicalType getPhysicalType() {
    return PhysicalType.INT32;
  }

  public void appendInt(int value) {
    values.add(value);
    markPresent();
  }

  @Override
  protected void appendValue(Object value) {
    values.add(((Integer) value).intValue());
  }

  @Override
  protected void copyValue(ColumnBuffer source, int denseIndex) {
    values.add(((Int32ColumnBuffer) source).values.getInt(denseIndex));
  }

  @Override
  protected ColumnBuffer newEmpty(int expectedValues) {
    return new Int32ColumnBuffer(expectedValues);
  }

  @Override
  protected void clearValues() {
    values.clear();
  }

  @Override
  public Integer getValue(int denseIndex) {
    return values.getInt(denseIndex);
  }

  public int getInt(int denseIndex) {
    return values.getInt(denseIndex);
  }

  public IntList values() {
    return values;
  }
}
