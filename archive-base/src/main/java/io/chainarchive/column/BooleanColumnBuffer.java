package io.chainarchive.column;

import io.chainarchive.schema.PhysicalType;

import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.booleans.BooleanList;

public class BooleanColumnBuffer extends ColumnBuffer {
  private final BooleanArrayList values;

  public BooleanColumnBuffer() {
    this.values = new BooleanArrayList();
  }

  private BooleanColumnBuffer(int expected) {
    this.values = new BooleanArrayList(expected);
  }

  @Override
  public PhysicalType getPhysicalType() {
    return PhysicalType.BOOLEAN;
  }

  public void appendBoolean(boolean value) {
    values.add(value);
    markPresent();
  }

  @Override
  protected void appendValue(Object value) {
    values.add(((Boolean) value).booleanValue());
  }

  @Override
  protected void copyValue(ColumnBuffer source, int denseIndex) {
    values.add(((BooleanColumnBuffer) source).values.getBoolean(denseIndex));
  }

  @Override
  protected ColumnBuffer newEmpty(int expectedValues) {
    return new BooleanColumnBuffer(expectedValues);
  }

  @Override
  protected void clearValues() {
    values.clear();
  }

  @Override
  public Boolean getValue(int denseIndex) {
    return values.getBoolean(denseIndex);
  }

  public boolean getBoolean(int denseIndex) {
    return values.getBoolean(denseIndex);
  }

  public BooleanList values() {
    return values;
  }
}
