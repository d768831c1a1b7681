package io.thetafun.sketch;

/**
 * Union of theta sketches built with the same seed. Tuple sketches are accepted as well; their
 * summaries are ignored.
 *
 * <pre>
 * ThetaUnion union = ThetaUnion.builder().build();
 * union.update(sketchA);
 * union.update(sketchB);
 * CompactThetaSketch result = union.getResult();
 * </pre>
 *
 * <p>Not thread-safe.
 */
public final class ThetaUnion
{
  private final Builder builder;
  private UnionState<Void> state;

  private ThetaUnion(Builder builder)
  {
    this.builder = builder;
    this.state = builder.newState();
  }

  public static Builder builder()
  {
    return new Builder();
  }

  /**
   * @throws SketchContractException if {@code sketch} was built with another seed
   */
  public void update(Sketch<?> sketch)
  {
    state.update(sketch);
  }

  /**
   * @return the union of everything merged so far; the union can keep being updated
   */
  public CompactThetaSketch getResult(boolean ordered)
  {
    CompactEntries entries = state.getResult(ordered);
    return new CompactThetaSketch(state.isEmpty(), ordered, state.getSeedHash(), entries.theta, entries.keys);
  }

  public CompactThetaSketch getResult()
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

  public static final class Builder extends SketchBuilder<Builder>
  {
    private Builder()
    {
    }

    public ThetaUnion build()
    {
      // later changes to this builder must not leak into reset()
      return new ThetaUnion(new Builder().copyFrom(this));
    }

    UnionState<Void> newState()
    {
      return new UnionState<>(newTable(false), seedHash(), null);
    }

    @Override
    Builder self()
    {
      return this;
    }
  }
}
