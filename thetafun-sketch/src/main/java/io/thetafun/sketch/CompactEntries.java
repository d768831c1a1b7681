package io.thetafun.sketch;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Dense, owned copy of the entries of a table, as stored by compact sketches.
 */
final class CompactEntries
{
  final long theta;
  final long[] keys;
  final Object[] summaries; // null when the source carries no summaries

  CompactEntries(long theta, long[] keys, Object[] summaries)
  {
    this.theta = theta;
    this.keys = keys;
    this.summaries = summaries;
  }

  /**
   * Copies every occupied slot whose key is below {@code theta}.
   */
  static CompactEntries copyOf(long[] slots, Object[] slotSummaries, long theta)
  {
    int count = 0;
    for (long key : slots) {
      if (key != 0 && key < theta) {
        count++;
      }
    }

    long[] keys = new long[count];
    Object[] summaries = slotSummaries == null ? null : new Object[count];
    int j = 0;
    for (int i = 0; i < slots.length; i++) {
      if (slots[i] != 0 && slots[i] < theta) {
        keys[j] = slots[i];
        if (summaries != null) {
          summaries[j] = slotSummaries[i];
        }
        j++;
      }
    }
    return new CompactEntries(theta, keys, summaries);
  }

  int size()
  {
    return keys.length;
  }

  /**
   * Keeps the {@code k} smallest keys and lowers theta to the next smallest one.
   * Keys are distinct, so exactly {@code k} entries remain.
   */
  CompactEntries limitTo(int k)
  {
    if (keys.length <= k) {
      return this;
    }
    final long[] scratch = keys.clone();
    final long newTheta = QuickSelect.select(scratch, scratch.length, k);
    return copyOf(keys, summaries, Math.min(theta, newTheta));
  }

  /**
   * @return a copy sorted ascending by key, summaries following their keys
   */
  CompactEntries sorted()
  {
    if (summaries == null) {
      long[] sortedKeys = keys.clone();
      Arrays.sort(sortedKeys);
      return new CompactEntries(theta, sortedKeys, null);
    }

    Integer[] order = new Integer[keys.length];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    Arrays.sort(order, Comparator.comparingLong(i -> keys[i]));

    long[] sortedKeys = new long[keys.length];
    Object[] sortedSummaries = new Object[keys.length];
    for (int i = 0; i < order.length; i++) {
      sortedKeys[i] = keys[order[i]];
      sortedSummaries[i] = summaries[order[i]];
    }
    return new CompactEntries(theta, sortedKeys, sortedSummaries);
  }
}
