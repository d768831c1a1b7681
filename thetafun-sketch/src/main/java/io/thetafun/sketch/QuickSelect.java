package io.thetafun.sketch;

import com.google.common.base.Preconditions;

/**
 * In-place order-statistic selection over {@code long} arrays.
 */
final class QuickSelect
{
  private QuickSelect()
  {
  }

  /**
   * Rearranges {@code arr[0, length)} so that {@code arr[index]} holds the value it would have if
   * the range were sorted, every value before it is not larger and every value after it is not
   * smaller.
   *
   * @return the selected value
   */
  static long select(long[] arr, int length, int index)
  {
    Preconditions.checkElementIndex(index, length);
    int lo = 0;
    int hi = length - 1;
    while (hi > lo) {
      int j = partition(arr, lo, hi);
      if (j == index) {
        return arr[index];
      }
      if (j > index) {
        hi = j - 1;
      } else {
        lo = j + 1;
      }
    }
    return arr[index];
  }

  // Hoare-style partition around the middle element, which is moved into its final slot
  private static int partition(long[] arr, int lo, int hi)
  {
    swap(arr, lo, lo + ((hi - lo) >>> 1));
    final long pivot = arr[lo];
    int i = lo;
    int j = hi + 1;
    while (true) {
      while (arr[++i] < pivot) {
        if (i == hi) {
          break;
        }
      }
      while (pivot < arr[--j]) {
        if (j == lo) {
          break;
        }
      }
      if (i >= j) {
        break;
      }
      swap(arr, i, j);
    }
    swap(arr, lo, j);
    return j;
  }

  private static void swap(long[] arr, int i, int j)
  {
    long tmp = arr[i];
    arr[i] = arr[j];
    arr[j] = tmp;
  }
}
