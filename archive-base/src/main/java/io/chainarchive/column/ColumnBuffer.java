package io.chainarchive.column;

import io.chainarchive.error.SchemaInvariantViolation;
import io.chainarchive.schema.PhysicalType;

import org.roaringbitmap.RoaringBitmap;

/**
 * An append-only single column: a dense list holding only the present values plus a presence track with
 * exactly one entry per appended row. The presence track is a bitmap of present row positions together with
 * the number of rows appended, so {@code size() == rows appended} and {@code valueCount() == present rows}
 * hold after every operation.
 */
public abstract class ColumnBuffer {
  protected final RoaringBitmap presence = new RoaringBitmap();
  protected int rowCount;

  public abstract PhysicalType getPhysicalType();

  /**
   * Appends one row.
   *
   * @param value The value, {@code null} appends an absent row.
   */
  public void append(Object value) {
    if (value == null) {
      appendNull();
      return;
    }
    if (!getPhysicalType().accepts(value))
      throw new SchemaInvariantViolation("The value of type " + value.getClass().getName() + " doesn't match for column type " + getPhysicalType());
    appendValue(value);
    markPresent();
  }

  public void appendNull() {
    rowCount++;
  }

  protected void markPresent() {
    presence.add(rowCount);
    rowCount++;
  }

  protected abstract void appendValue(Object value);

  /**
   * Appends the dense value at {@code denseIndex} of another buffer of the same type to this buffer's dense
   * values, the caller is responsible for the presence track.
   */
  protected abstract void copyValue(ColumnBuffer source, int denseIndex);

  protected abstract ColumnBuffer newEmpty(int expectedValues);

  protected abstract void clearValues();

  /**
   * @param denseIndex Position in the dense value list.
   *
   * @return The boxed value.
   */
  public abstract Object getValue(int denseIndex);

  public boolean isPresent(int row) {
    checkRow(row);
    return presence.contains(row);
  }

  /**
   * @param row The row position.
   *
   * @return The boxed value of the row or {@code null} if the row is absent.
   */
  public Object valueAtRow(int row) {
    checkRow(row);
    if (!presence.contains(row))
      return null;
    // rank counts present rows <= row
    return getValue((int) presence.rank(row) - 1);
  }

  /**
   * @return The number of rows appended, present or not.
   */
  public int size() {
    return rowCount;
  }

  /**
   * @return The number of present rows, the length of the dense value list.
   */
  public int valueCount() {
    return presence.getCardinality();
  }

  public boolean hasNulls() {
    return valueCount() != rowCount;
  }

  /**
   * @return A copy of the presence track.
   */
  public RoaringBitmap presence() {
    return presence.clone();
  }

  public void clear() {
    presence.clear();
    rowCount = 0;
    clearValues();
  }

  /**
   * Builds a new buffer whose row {@code i} is this buffer's row {@code indices[i]}. Dense values and
   * presence move together so present rows keep their values and absent rows stay absent.
   *
   * @param indices A permutation of {@code 0..size()-1}.
   *
   * @return The permuted copy, this buffer is left untouched.
   */
  public ColumnBuffer permute(int[] indices) {
    if (indices.length != rowCount)
      throw new IllegalArgumentException("Permutation has " + indices.length + " entries but column has " + rowCount + " rows");
    int[] denseIndexes = new int[rowCount];
    int dense = 0;
    for (int row = 0; row < rowCount; row++) {
      denseIndexes[row] = presence.contains(row) ? dense++ : -1;
    }
    boolean[] seen = new boolean[rowCount];
    ColumnBuffer permuted = newEmpty(dense);
    for (int i = 0; i < indices.length; i++) {
      int source = indices[i];
      if (source < 0 || source >= rowCount || seen[source])
        throw new IllegalArgumentException("Not a permutation, row " + source + " at position " + i);
      seen[source] = true;
      if (denseIndexes[source] >= 0) {
        permuted.copyValue(this, denseIndexes[source]);
        permuted.markPresent();
      } else {
        permuted.appendNull();
      }
    }
    return permuted;
  }

  private void checkRow(int row) {
    if (row < 0 || row >= rowCount)
      throw new IndexOutOfBoundsException("Row " + row + " out of " + rowCount);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{rows=" + rowCount + ", values=" + valueCount() + '}';
  }
}
