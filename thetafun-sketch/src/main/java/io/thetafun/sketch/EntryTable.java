package io.thetafun.sketch;

import com.google.common.base.Verify;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Open-addressed table of retained hashes, optionally with one summary per hash, shared by the
 * update sketches and the unions.
 *
 * <p>0 marks an empty slot. Collisions are resolved by linear probing. The table grows by the
 * resize factor once more than half full, up to twice the nominal size; at that size it is
 * rebuilt instead once three quarters full: theta drops to the (k+1)-th smallest hash and only
 * the k smallest hashes are kept.
 */
final class EntryTable<S>
{
  private static final Logger LOG = LoggerFactory.getLogger(EntryTable.class);

  private final int lgNomSize;
  private final int lgResizeFactor;
  private final boolean withSummaries;
  private final EntryAllocator allocator;

  private int lgCurSize;
  private long theta;
  private boolean isEmpty;
  private int numEntries;
  private long[] keys; // keys.length is always a power of 2
  private Object[] summaries; // null unless withSummaries

  EntryTable(
      int lgCurSize,
      int lgNomSize,
      int lgResizeFactor,
      long theta,
      boolean withSummaries,
      EntryAllocator allocator
  )
  {
    this.lgCurSize = lgCurSize;
    this.lgNomSize = lgNomSize;
    this.lgResizeFactor = lgResizeFactor;
    this.theta = theta;
    this.withSummaries = withSummaries;
    this.allocator = allocator;
    this.isEmpty = true;
    this.keys = allocator.allocateHashes(1 << lgCurSize);
    this.summaries = withSummaries ? allocator.allocateSummaries(1 << lgCurSize) : null;
  }

  private EntryTable(EntryTable<S> that)
  {
    this.lgCurSize = that.lgCurSize;
    this.lgNomSize = that.lgNomSize;
    this.lgResizeFactor = that.lgResizeFactor;
    this.theta = that.theta;
    this.withSummaries = that.withSummaries;
    this.allocator = that.allocator;
    this.isEmpty = that.isEmpty;
    this.numEntries = that.numEntries;
    this.keys = that.keys.clone();
    this.summaries = that.summaries == null ? null : that.summaries.clone();
  }

  EntryTable<S> copy()
  {
    return new EntryTable<>(this);
  }

  /**
   * Number of entries a table of size {@code 2^lgSize} holds before it has to grow or be rebuilt.
   */
  static int capacity(int lgSize, int lgNomSize)
  {
    final double threshold = lgSize <= lgNomSize
                             ? ThetaConstants.RESIZE_THRESHOLD
                             : ThetaConstants.REBUILD_THRESHOLD;
    return (int) (threshold * (1 << lgSize));
  }

  /**
   * Marks the table as non-empty and returns {@code hash}, or 0 if it does not pass theta.
   */
  long screen(long hash)
  {
    isEmpty = false;
    if (hash >= theta) {
      return 0;
    }
    return hash;
  }

  /**
   * @return the slot holding {@code key}, or {@code ~slot} of the empty slot where it would go
   */
  int find(long key)
  {
    final int mask = keys.length - 1;
    int index = (int) key & mask;
    // linear probe until search hit or miss
    while (keys[index] != 0 && keys[index] != key) {
      index = (index + 1) & mask;
    }
    return keys[index] == 0 ? ~index : index;
  }

  void insert(int index, long key, S summary)
  {
    keys[index] = key;
    if (withSummaries) {
      summaries[index] = summary;
    }
    numEntries++;

    if (numEntries > capacity(lgCurSize, lgNomSize)) {
      if (lgCurSize <= lgNomSize) {
        resize();
      } else {
        rebuild();
      }
    }
  }

  /**
   * Lowers theta to {@code newTheta} if that is smaller, dropping the entries that no longer pass.
   */
  void lowerTheta(long newTheta)
  {
    if (newTheta >= theta) {
      return;
    }
    theta = newTheta;
    if (numEntries > 0) {
      final long[] oldKeys = keys;
      final Object[] oldSummaries = summaries;
      allocate(lgCurSize);
      numEntries = reinsert(oldKeys, oldSummaries, theta);
    }
  }

  @SuppressWarnings("unchecked")
  S getSummary(int index)
  {
    return withSummaries ? (S) summaries[index] : null;
  }

  void setSummary(int index, S summary)
  {
    if (withSummaries) {
      summaries[index] = summary;
    }
  }

  /**
   * Shrinks the table to the smallest size whose load threshold still fits every entry.
   * Theta and the entries are left as they are.
   */
  void trim()
  {
    int lgNewSize = Math.min(ThetaConstants.MIN_LG_SIZE, lgCurSize);
    while (lgNewSize < lgCurSize && numEntries > capacity(lgNewSize, lgNomSize)) {
      lgNewSize++;
    }
    if (lgNewSize < lgCurSize) {
      LOG.debug("Trimming table from 2^{} to 2^{} slots for {} entries", lgCurSize, lgNewSize, numEntries);
      rehash(lgNewSize);
    }
  }

  private void resize()
  {
    // a resize factor of 1 only starts below the ceiling after a trim; go straight back to it
    final int lgNewSize = lgResizeFactor == 0
                          ? lgNomSize + 1
                          : Math.min(lgCurSize + lgResizeFactor, lgNomSize + 1);
    LOG.debug("Resizing table from 2^{} to 2^{} slots at {} entries", lgCurSize, lgNewSize, numEntries);
    rehash(lgNewSize);
  }

  private void rehash(int lgNewSize)
  {
    final long[] oldKeys = keys;
    final Object[] oldSummaries = summaries;
    allocate(lgNewSize);
    final int placed = reinsert(oldKeys, oldSummaries, ThetaConstants.MAX_THETA);
    Verify.verify(placed == numEntries, "lost entries while rehashing: %s of %s", placed, numEntries);
  }

  // If there are too many entries at the ceiling, keep the nominal number of smallest hashes.
  private void rebuild()
  {
    final int nominal = 1 << lgNomSize;
    final long[] hashes = new long[numEntries];
    int count = 0;
    for (long key : keys) {
      if (key != 0) {
        hashes[count++] = key;
      }
    }
    Verify.verify(count == numEntries, "entry count %s does not match %s occupied slots", numEntries, count);

    final long newTheta = QuickSelect.select(hashes, count, nominal);
    LOG.debug("Rebuilding table at {} entries, theta {} -> {}", numEntries, theta, newTheta);
    theta = newTheta;

    final long[] oldKeys = keys;
    final Object[] oldSummaries = summaries;
    allocate(lgCurSize);
    numEntries = reinsert(oldKeys, oldSummaries, theta);
    Verify.verify(numEntries == nominal, "rebuild kept %s entries instead of %s", numEntries, nominal);
  }

  private void allocate(int lgNewSize)
  {
    lgCurSize = lgNewSize;
    keys = allocator.allocateHashes(1 << lgNewSize);
    summaries = withSummaries ? allocator.allocateSummaries(1 << lgNewSize) : null;
  }

  private int reinsert(long[] oldKeys, Object[] oldSummaries, long limit)
  {
    final int mask = keys.length - 1;
    int placed = 0;
    for (int i = 0; i < oldKeys.length; i++) {
      final long key = oldKeys[i];
      if (key == 0 || key >= limit) {
        continue;
      }
      int index = (int) key & mask;
      while (keys[index] != 0) {
        index = (index + 1) & mask;
      }
      keys[index] = key;
      if (withSummaries) {
        summaries[index] = oldSummaries[i];
      }
      placed++;
    }
    return placed;
  }

  void setEmpty(boolean isEmpty)
  {
    this.isEmpty = isEmpty;
  }

  boolean isEmpty()
  {
    return isEmpty;
  }

  long getTheta()
  {
    return theta;
  }

  int getNumEntries()
  {
    return numEntries;
  }

  int getLgCurSize()
  {
    return lgCurSize;
  }

  int getLgNomSize()
  {
    return lgNomSize;
  }

  int getLgResizeFactor()
  {
    return lgResizeFactor;
  }

  boolean hasSummaries()
  {
    return withSummaries;
  }

  // backing arrays, read by sketches and unions that are in the same package; never written there
  long[] keys()
  {
    return keys;
  }

  Object[] summaries()
  {
    return summaries;
  }
}
