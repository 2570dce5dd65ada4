package io.chainarchive.write.batch;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;

import com.google.common.primitives.UnsignedBytes;

import io.chainarchive.column.ByteArrayColumnBuffer;
import io.chainarchive.key.CompositeKeyExtractor;

/**
 * How the composite identifiers of extrinsics, events and calls are ordered within a row group.
 */
public enum IdentifierOrder {
  /**
   * Unsigned byte-wise comparison of the identifier. Matches block order only while all heights have the same
   * number of digits, zero padded identifiers are always in block order.
   */
  LEXICAL {
    @Override
    public int[] sort(ByteArrayColumnBuffer ids) {
      return RowPermutation.<byte[]>sort(ids, BYTES);
    }
  },
  /**
   * By the block height parsed from the identifier, ties broken lexically.
   */
  NUMERIC_PREFIX {
    @Override
    public int[] sort(ByteArrayColumnBuffer ids) {
      int rows = ids.size();
      HeightKey[] keys = new HeightKey[rows];
      int dense = 0;
      for (int row = 0; row < rows; row++) {
        if (ids.isPresent(row)) {
          byte[] id = ids.getValue(dense++);
          keys[row] = new HeightKey(CompositeKeyExtractor.extractNumericPrefix(new String(id, StandardCharsets.UTF_8)), id);
        }
      }
      return RowPermutation.sort(keys, HEIGHT_THEN_BYTES);
    }
  };

  private static final Comparator<byte[]> BYTES = UnsignedBytes.lexicographicalComparator();
  private static final Comparator<HeightKey> HEIGHT_THEN_BYTES = Comparator.<HeightKey>comparingLong(k -> k.height)
      .thenComparing(k -> k.id, BYTES);

  public abstract int[] sort(ByteArrayColumnBuffer ids);

  public static IdentifierOrder getIdentifierOrder(String value) {
    for (IdentifierOrder order : IdentifierOrder.values()) {
      if (order.name().equalsIgnoreCase(value))
        return order;
    }
    return null;
  }

  private static final class HeightKey {
    private final long height;
    private final byte[] id;

    private HeightKey(long height, byte[] id) {
      this.height = height;
      this.id = id;
    }
  }
}
