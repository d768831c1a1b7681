package io.thetafun.sketch;

import com.google.common.base.Preconditions;

/**
 * Union of tuple sketches built with the same seed. When a hash is retained by more than one
 * input, its summaries are combined with the union's {@link MergePolicy}.
 *
 * <p>Not thread-safe.
 *
 * @param <S> summary type, treated as an immutable value
 */
public final class TupleUnion<S>
{
  private final Builder<S> builder;
  private UnionState<S> state;

  private TupleUnion(Builder<S> builder)
  {
    this.builder = builder;
    this.state = builder.newState();
  }

  public static <S> Builder<S> builder(MergePolicy<S> policy)
  {
    return new Builder<>(policy);
  }

  /**
   * Merges {@code sketch} into the union.
   *
   * @throws SketchContractException if {@code sketch} was built with another seed
   * @throws RuntimeException        whatever the merge policy throws; the union is left unchanged
   */
  public void update(Sketch<TupleEntry<S>> sketch)
  {
    state.update(sketch);
  }

  /**
   * @return the union of everything merged so far; the union can keep being updated
   */
  public CompactTupleSketch<S> getResult(boolean ordered)
  {
    CompactEntries entries = state.getResult(ordered);
    return new CompactTupleSketch<>(
        state.isEmpty(),
        ordered,
        state.getSeedHash(),
        entries.theta,
        entries.keys,
        entries.summaries
    );
  }

  public CompactTupleSketch<S> getResult()
  {
    return getResult(true);
  }

  /**
   * Forgets everything merged so far.
   */
  public void reset()
  {
    state = builder.newState();
  }

  public MergePolicy<S> getPolicy()
  {
    return builder.policy;
  }

  public static final class Builder<S> extends SketchBuilder<Builder<S>>
  {
    private final MergePolicy<S> policy;

    private Builder(MergePolicy<S> policy)
    {
      this.policy = Preconditions.checkNotNull(policy, "policy");
    }

    public TupleUnion<S> build()
    {
      // later changes to this builder must not leak into reset()
      return new TupleUnion<>(new Builder<>(policy).copyFrom(this));
    }

    UnionState<S> newState()
    {
      return new UnionState<>(newTable(true), seedHash(), policy);
    }

    @Override
    Builder<S> self()
    {
      return this;
    }
  }
}
