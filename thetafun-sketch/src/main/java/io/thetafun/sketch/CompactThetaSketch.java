package io.thetafun.sketch;

import com.google.common.base.Preconditions;

import java.util.Arrays;

import static io.thetafun.sketch.SketchContractException.checkContract;

/**
 * Immutable theta sketch: a dense copy of retained hashes, optionally sorted. Safe to share
 * between threads.
 */
public final class CompactThetaSketch extends Sketch<Long>
{
  private final boolean isEmpty;
  private final boolean isOrdered;
  private final short seedHash;
  private final long theta;
  private final long[] hashes;

  CompactThetaSketch(boolean isEmpty, boolean isOrdered, short seedHash, long theta, long[] hashes)
  {
    this.isEmpty = isEmpty;
    this.isOrdered = isOrdered;
    this.seedHash = seedHash;
    this.theta = theta;
    this.hashes = hashes;
  }

  static CompactThetaSketch copyOf(Sketch<?> source, boolean ordered)
  {
    CompactEntries entries = CompactEntries.copyOf(source.keys(), null, source.getTheta64());
    boolean sort = ordered && !source.isOrdered();
    if (sort) {
      entries = entries.sorted();
    }
    return new CompactThetaSketch(
        source.isEmpty(),
        sort || source.isOrdered(),
        source.getSeedHash(),
        entries.theta,
        entries.keys
    );
  }

  /**
   * Rebuilds a compact sketch from its decoded fields.
   *
   * @throws SketchContractException if the hashes are not valid retained hashes for {@code theta},
   *                                 are duplicated, or are not ascending although {@code isOrdered}
   */
  public static CompactThetaSketch of(boolean isEmpty, boolean isOrdered, short seedHash, long theta, long[] hashes)
  {
    Preconditions.checkNotNull(hashes, "hashes");
    checkContract(theta > 0, "theta must be positive: %s", theta);
    checkContract(!isEmpty || hashes.length == 0, "an empty sketch cannot retain %s hashes", hashes.length);
    long[] copy = hashes.clone();
    for (long hash : copy) {
      checkContract(hash > 0 && hash < theta, "hash %s is not in (0, theta = %s)", hash, theta);
    }
    long[] sorted = copy;
    if (!isOrdered) {
      sorted = copy.clone();
      Arrays.sort(sorted);
    }
    for (int i = 1; i < sorted.length; i++) {
      checkContract(sorted[i - 1] < sorted[i], "hashes must be distinct and, if ordered, ascending: %s", sorted[i]);
    }
    return new CompactThetaSketch(isEmpty, isOrdered, seedHash, theta, copy);
  }

  /**
   * @return this sketch if it already satisfies {@code ordered}, a sorted copy otherwise
   */
  public CompactThetaSketch compact(boolean ordered)
  {
    if (!ordered || isOrdered) {
      return this;
    }
    return copyOf(this, true);
  }

  /**
   * @return a copy of the retained hashes, in iteration order
   */
  public long[] getHashes()
  {
    return hashes.clone();
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
    return null;
  }

  @Override
  Long toEntry(long key, Object summary)
  {
    return key;
  }
}
