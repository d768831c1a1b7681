package io.thetafun.sketch;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;

/**
 * Mutable sketch backed by an {@link EntryTable}. Items are hashed with the seeded hash
 * function; hashes at or above theta are discarded.
 *
 * <p>Not thread-safe: a single owner updates the sketch, concurrent readers have to work on a
 * {@link #compact} copy.
 */
public abstract class UpdateSketch<E, S> extends Sketch<E>
{
  final EntryTable<S> table;
  final HashFunction hashFunction;
  private final short seedHash;

  UpdateSketch(EntryTable<S> table, HashFunction hashFunction, short seedHash)
  {
    this.table = table;
    this.hashFunction = hashFunction;
    this.seedHash = seedHash;
  }

  /**
   * Shrinks the table to the smallest size that still holds every retained entry.
   * Theta and the retained entries do not change.
   */
  public void trim()
  {
    table.trim();
  }

  /**
   * @param ordered whether the copy should be sorted by hash
   * @return an immutable copy that shares no state with this sketch
   */
  public abstract Sketch<E> compact(boolean ordered);

  public Sketch<E> compact()
  {
    return compact(true);
  }

  public int getLgK()
  {
    return table.getLgNomSize();
  }

  public int getLgCurrentSize()
  {
    return table.getLgCurSize();
  }

  public int getResizeFactor()
  {
    return 1 << table.getLgResizeFactor();
  }

  @Override
  public boolean isEmpty()
  {
    return table.isEmpty();
  }

  @Override
  public boolean isOrdered()
  {
    return false;
  }

  @Override
  public long getTheta64()
  {
    return table.getTheta();
  }

  @Override
  public int getNumRetained()
  {
    return table.getNumEntries();
  }

  @Override
  public short getSeedHash()
  {
    return seedHash;
  }

  /**
   * @return the sketch hash of the item if it passes theta and should be probed, 0 otherwise
   */
  long hashAndScreen(HashCode hashCode)
  {
    return table.screen(SketchHashing.toSketchHash(hashCode));
  }

  static long canonicalDoubleBits(double value)
  {
    // -0.0 and 0.0 are one item; doubleToLongBits already collapses all NaNs
    return Double.doubleToLongBits(value == 0.0 ? 0.0 : value);
  }

  @Override
  void appendSpecifics(StringBuilder sb)
  {
    sb.append(String.format("   lg nominal size      : %d%n", getLgK()));
    sb.append(String.format("   lg current size      : %d%n", getLgCurrentSize()));
    sb.append(String.format("   resize factor        : %d%n", getResizeFactor()));
  }

  @Override
  long[] keys()
  {
    return table.keys();
  }

  @Override
  Object[] summaries()
  {
    return table.summaries();
  }
}
