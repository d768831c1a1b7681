package io.thetafun.sketch;

import com.google.common.base.Preconditions;

import java.util.Arrays;
import java.util.List;

import static io.thetafun.sketch.SketchContractException.checkContract;

/**
 * Immutable tuple sketch: a dense copy of retained hashes and their summaries, optionally
 * sorted by hash. Safe to share between threads as long as the summaries are immutable.
 */
public final class CompactTupleSketch<S> extends Sketch<TupleEntry<S>>
{
  private final boolean isEmpty;
  private final boolean isOrdered;
  private final short seedHash;
  private final long theta;
  private final long[] hashes;
  private final Object[] summaries;

  CompactTupleSketch(
      boolean isEmpty,
      boolean isOrdered,
      short seedHash,
      long theta,
      long[] hashes,
      Object[] summaries
  )
  {
    this.isEmpty = isEmpty;
    this.isOrdered = isOrdered;
    this.seedHash = seedHash;
    this.theta = theta;
    this.hashes = hashes;
    this.summaries = summaries;
  }

  static <S> CompactTupleSketch<S> copyOf(Sketch<TupleEntry<S>> source, boolean ordered)
  {
    CompactEntries entries = CompactEntries.copyOf(source.keys(), source.summaries(), source.getTheta64());
    boolean sort = ordered && !source.isOrdered();
    if (sort) {
      entries = entries.sorted();
    }
    return new CompactTupleSketch<>(
        source.isEmpty(),
        sort || source.isOrdered(),
        source.getSeedHash(),
        entries.theta,
        entries.keys,
        entries.summaries
    );
  }

  /**
   * Rebuilds a compact tuple sketch from its decoded fields.
   *
   * @throws SketchContractException if the hashes are not valid retained hashes for {@code theta},
   *                                 are duplicated, or are not ascending although {@code isOrdered}
   */
  public static <S> CompactTupleSketch<S> of(
      boolean isEmpty,
      boolean isOrdered,
      short seedHash,
      long theta,
      List<TupleEntry<S>> entries
  )
  {
    Preconditions.checkNotNull(entries, "entries");
    checkContract(theta > 0, "theta must be positive: %s", theta);
    checkContract(!isEmpty || entries.isEmpty(), "an empty sketch cannot retain %s entries", entries.size());

    long[] hashes = new long[entries.size()];
    Object[] summaries = new Object[entries.size()];
    for (int i = 0; i < hashes.length; i++) {
      TupleEntry<S> entry = entries.get(i);
      checkContract(
          entry.getHash() > 0 && entry.getHash() < theta,
          "hash %s is not in (0, theta = %s)",
          entry.getHash(),
          theta
      );
      hashes[i] = entry.getHash();
      summaries[i] = Preconditions.checkNotNull(entry.getSummary(), "summary of hash %s", entry.getHash());
    }

    long[] sorted = hashes;
    if (!isOrdered) {
      sorted = hashes.clone();
      Arrays.sort(sorted);
    }
    for (int i = 1; i < sorted.length; i++) {
      checkContract(sorted[i - 1] < sorted[i], "hashes must be distinct and, if ordered, ascending: %s", sorted[i]);
    }
    return new CompactTupleSketch<>(isEmpty, isOrdered, seedHash, theta, hashes, summaries);
  }

  /**
   * @return this sketch if it already satisfies {@code ordered}, a sorted copy otherwise
   */
  public CompactTupleSketch<S> compact(boolean ordered)
  {
    if (!ordered || isOrdered) {
      return this;
    }
    return copyOf(this, true);
  }

  /**
   * Drops the summaries, keeping the hashes, theta, seed hash and flags.
   */
  public CompactThetaSketch toThetaSketch()
  {
    return new CompactThetaSketch(isEmpty, isOrdered, seedHash, theta, hashes.clone());
  }

  @Override
  public boolean isEmpty()
  {
    return isEmpty;
  }

  @Override
  public boolean isOrdered()
  {
    return isOrdered;
  }

  @Override
  public long getTheta64()
  {
    return theta;
  }

  @Override
  public int getNumRetained()
  {
    return hashes.length;
  }

  @Override
  public short getSeedHash()
  {
    return seedHash;
  }

  @Override
  long[] keys()
  {
    return hashes;
  }

  @Override
  Object[] summaries()
  {
    return summaries;
  }

  @Override
  @SuppressWarnings("unchecked")
  TupleEntry<S> toEntry(long key, Object summary)
  {
    return TupleEntry.of(key, (S) summary);
  }
}
