package io.chainarchive.key;

import java.util.Objects;

/**
 * An inclusive range of block heights, carried along with every submission so a pipeline knows which blocks
 * the rows it holds came from.
 */
public final class BlockRange {
  private final long from;
  private final long to;

  public BlockRange(long from, long to) {
    if (from < 0 || to < from)
      throw new IllegalArgumentException("Invalid block range " + from + ".." + to);
    this.from = from;
    this.to = to;
  }

  public static BlockRange of(long height) {
    return new BlockRange(height, height);
  }

  public long getFrom() {
    return from;
  }

  public long getTo() {
    return to;
  }

  public boolean contains(long height) {
    return height >= from && height <= to;
  }

  public BlockRange union(BlockRange other) {
    if (other == null)
      return this;
    return new BlockRange(Math.min(from, other.from), Math.max(to, other.to));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    BlockRange that = (BlockRange) o;
    return from == that.from && to == that.to;
  }

  @Override
  public int hashCode() {
    return Objects.hash(from, to);
  }

  @Override
  public String toString() {
    return from == to ? Long.toString(from) : from + ".." + to;
  }
}
