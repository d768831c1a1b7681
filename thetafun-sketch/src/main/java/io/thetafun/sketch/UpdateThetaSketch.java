package io.thetafun.sketch;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;

import java.nio.charset.StandardCharsets;

/**
 * Theta sketch that counts distinct items.
 *
 * <pre>
 * UpdateThetaSketch sketch = UpdateThetaSketch.builder().setLgK(12).build();
 * sketch.update("user-42");
 * double estimate = sketch.getEstimate();
 * </pre>
 */
public final class UpdateThetaSketch extends UpdateSketch<Long, Void>
{
  private UpdateThetaSketch(EntryTable<Void> table, HashFunction hashFunction, short seedHash)
  {
    super(table, hashFunction, seedHash);
  }

  public static Builder builder()
  {
    return new Builder();
  }

  public void update(long value)
  {
    updateHash(hashFunction.hashLong(value));
  }

  public void update(int value)
  {
    update((long) value);
  }

  public void update(double value)
  {
    update(canonicalDoubleBits(value));
  }

  /**
   * Empty strings are ignored.
   */
  public void update(String value)
  {
    if (value == null || value.isEmpty()) {
      return;
    }
    updateHash(hashFunction.hashString(value, StandardCharsets.UTF_8));
  }

  /**
   * Empty arrays are ignored.
   */
  public void update(byte[] value)
  {
    if (value == null || value.length == 0) {
      return;
    }
    updateHash(hashFunction.hashBytes(value));
  }

  public void update(long[] values)
  {
    if (values == null || values.length == 0) {
      return;
    }
    Hasher hasher = hashFunction.newHasher();
    for (long value : values) {
      hasher.putLong(value);
    }
    updateHash(hasher.hash());
  }

  public void update(int[] values)
  {
    if (values == null || values.length == 0) {
      return;
    }
    Hasher hasher = hashFunction.newHasher();
    for (int value : values) {
      hasher.putInt(value);
    }
    updateHash(hasher.hash());
  }

  private void updateHash(HashCode hashCode)
  {
    final long hash = hashAndScreen(hashCode);
    if (hash == 0) {
      return;
    }
    final int index = table.find(hash);
    if (index < 0) {
      table.insert(~index, hash, null);
    }
  }

  @Override
  public CompactThetaSketch compact(boolean ordered)
  {
    return CompactThetaSketch.copyOf(this, ordered);
  }

  @Override
  public CompactThetaSketch compact()
  {
    return compact(true);
  }

  @Override
  Long toEntry(long key, Object summary)
  {
    return key;
  }

  public static final class Builder extends SketchBuilder<Builder>
  {
    private Builder()
    {
    }

    public UpdateThetaSketch build()
    {
      EntryTable<Void> table = newTable(false);
      return new UpdateThetaSketch(table, SketchHashing.hashFunction(getSeed()), seedHash());
    }

    @Override
    Builder self()
    {
      return this;
    }
  }
}
