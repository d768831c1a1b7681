package io.thetafun.sketch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Working state of a union: a table shaped like an update sketch's and the running theta, the
 * minimum theta of everything merged so far. The table theta follows the running theta, so no
 * retained entry is ever at or above it.
 *
 * <p>Without a merge policy, colliding entries keep the summary already retained.
 */
final class UnionState<S>
{
  private static final Logger LOG = LoggerFactory.getLogger(UnionState.class);

  private final short seedHash;
  private final MergePolicy<S> policy;
  private EntryTable<S> table;
  private long unionTheta;

  UnionState(EntryTable<S> table, short seedHash, MergePolicy<S> policy)
  {
    this.table = table;
    this.seedHash = seedHash;
    this.policy = policy;
    this.unionTheta = table.getTheta();
  }

  /**
   * Merges the retained entries of {@code sketch}. If the seed hashes differ, or the merge policy
   * throws, the union is left as it was and the exception propagates.
   */
  void update(Sketch<?> sketch)
  {
    SketchHashing.checkSeedHashes(seedHash, sketch.getSeedHash());
    if (sketch.isEmpty()) {
      return;
    }

    // summaries are merged on a copy so that a failing policy leaves the union untouched
    final EntryTable<S> working = policy == null ? table : table.copy();
    final long sketchTheta = Math.min(unionTheta, sketch.getTheta64());
    working.setEmpty(false);
    working.lowerTheta(sketchTheta);

    final long[] keys = sketch.keys();
    final Object[] summaries = working.hasSummaries() ? sketch.summaries() : null;
    final boolean ordered = sketch.isOrdered();
    for (int i = 0; i < keys.length; i++) {
      final long key = keys[i];
      if (key == 0) {
        continue;
      }
      // the table theta drops further whenever merging forces a rebuild
      if (key >= working.getTheta()) {
        if (ordered) {
          break;
        }
        continue;
      }
      final S incoming = summaryAt(summaries, i);
      final int index = working.find(key);
      if (index < 0) {
        working.insert(~index, key, incoming);
      } else if (policy != null) {
        working.setSummary(index, policy.merge(working.getSummary(index), incoming));
      }
    }

    table = working;
    unionTheta = working.getTheta();
  }

  /**
   * Copies the current state into compact entries, keeping at most the nominal number of the
   * smallest hashes. The union itself is not modified.
   */
  CompactEntries getResult(boolean ordered)
  {
    final long theta = unionTheta;
    CompactEntries entries = CompactEntries.copyOf(table.keys(), table.summaries(), theta);
    final int nominal = 1 << table.getLgNomSize();
    if (entries.size() > nominal) {
      entries = entries.limitTo(nominal);
      LOG.debug("Union result limited to {} entries, theta {} -> {}", nominal, theta, entries.theta);
    }
    if (ordered) {
      entries = entries.sorted();
    }
    return entries;
  }

  boolean isEmpty()
  {
    return table.isEmpty();
  }

  short getSeedHash()
  {
    return seedHash;
  }

  long getUnionTheta()
  {
    return unionTheta;
  }

  int getNumEntries()
  {
    return table.getNumEntries();
  }

  @SuppressWarnings("unchecked")
  private S summaryAt(Object[] summaries, int i)
  {
    return summaries == null ? null : (S) summaries[i];
  }
}
