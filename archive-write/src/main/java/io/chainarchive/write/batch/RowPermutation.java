package io.chainarchive.write.batch;

import java.util.Comparator;

import io.chainarchive.column.ColumnBuffer;

import it.unimi.dsi.fastutil.ints.IntArrays;

/**
 * Computes the shared sort permutation of a batch from one key column.
 */
public final class RowPermutation {
  private RowPermutation() {
  }

  /**
   * Stable ascending order over the rows of {@code key}. Absent keys sort last, equal keys keep insertion order.
   *
   * @param key        The key column.
   * @param comparator Orders the boxed values of present rows.
   *
   * @return An index array where position {@code i} holds the original row placed at {@code i}.
   */
  @SuppressWarnings("unchecked")
  public static <K> int[] sort(ColumnBuffer key, Comparator<? super K> comparator) {
    int rows = key.size();
    Object[] keys = new Object[rows];
    int dense = 0;
    for (int row = 0; row < rows; row++) {
      if (key.isPresent(row))
        keys[row] = key.getValue(dense++);
    }
    return sort(keys, (Comparator<Object>) comparator);
  }

  /**
   * Same as {@link #sort(ColumnBuffer, Comparator)} over precomputed keys, {@code null} meaning absent.
   */
  public static <K> int[] sort(K[] keys, Comparator<? super K> comparator) {
    int[] permutation = identity(keys.length);
    // mergeSort is stable
    IntArrays.mergeSort(permutation, (a, b) -> {
      K left = keys[a];
      K right = keys[b];
      if (left == null)
        return right == null ? 0 : 1;
      if (right == null)
        return -1;
      return comparator.compare(left, right);
    });
    return permutation;
  }

  public static int[] identity(int rows) {
    int[] permutation = new int[rows];
    for (int i = 0; i < rows; i++)
      permutation[i] = i;
    return permutation;
  }
}
