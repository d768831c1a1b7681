package io.thetafun.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;

import java.nio.charset.StandardCharsets;

/**
 * Tuple sketch: a theta sketch that keeps a summary for every retained key. Updating a key that
 * is already retained combines the two summaries with the sketch's {@link MergePolicy}.
 *
 * @param <S> summary type, treated as an immutable value
 */
public final class UpdateTupleSketch<S> extends UpdateSketch<TupleEntry<S>, S>
{
  private final MergePolicy<S> policy;

  private UpdateTupleSketch(EntryTable<S> table, HashFunction hashFunction, short seedHash, MergePolicy<S> policy)
  {
    super(table, hashFunction, seedHash);
    this.policy = policy;
  }

  public static <S> Builder<S> builder(MergePolicy<S> policy)
  {
    return new Builder<>(policy);
  }

  public void update(long key, S summary)
  {
    updateHash(hashFunction.hashLong(key), summary);
  }

  public void update(double key, S summary)
  {
    update(canonicalDoubleBits(key), summary);
  }

  /**
   * Empty keys are ignored.
   */
  public void update(String key, S summary)
  {
    if (key == null || key.isEmpty()) {
      return;
    }
    updateHash(hashFunction.hashString(key, StandardCharsets.UTF_8), summary);
  }

  /**
   * Empty keys are ignored.
   */
  public void update(byte[] key, S summary)
  {
    if (key == null || key.length == 0) {
      return;
    }
    updateHash(hashFunction.hashBytes(key), summary);
  }

  private void updateHash(HashCode hashCode, S summary)
  {
    Preconditions.checkNotNull(summary, "summary");
    final long hash = hashAndScreen(hashCode);
    if (hash == 0) {
      return;
    }
    final int index = table.find(hash);
    if (index < 0) {
      table.insert(~index, hash, summary);
    } else {
      table.setSummary(index, policy.merge(table.getSummary(index), summary));
    }
  }

  public MergePolicy<S> getPolicy()
  {
    return policy;
  }

  @Override
  public CompactTupleSketch<S> compact(boolean ordered)
  {
    return CompactTupleSketch.copyOf(this, ordered);
  }

  @Override
  public CompactTupleSketch<S> compact()
  {
    return compact(true);
  }

  @Override
  @SuppressWarnings("unchecked")
  TupleEntry<S> toEntry(long key, Object summary)
  {
    return TupleEntry.of(key, (S) summary);
  }

  public static final class Builder<S> extends SketchBuilder<Builder<S>>
  {
    private final MergePolicy<S> policy;

    private Builder(MergePolicy<S> policy)
    {
      this.policy = Preconditions.checkNotNull(policy, "policy");
    }

    public UpdateTupleSketch<S> build()
    {
      EntryTable<S> table = newTable(true);
      return new UpdateTupleSketch<>(table, SketchHashing.hashFunction(getSeed()), seedHash(), policy);
    }

    @Override
    Builder<S> self()
    {
      return this;
    }
  }
}
