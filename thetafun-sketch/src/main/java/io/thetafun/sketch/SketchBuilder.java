package io.thetafun.sketch;

import com.google.common.base.Preconditions;

import static io.thetafun.sketch.SketchContractException.checkContract;

/**
 * Configuration shared by the update sketch and union builders.
 *
 * @param <B> concrete builder type, returned by every setter
 */
public abstract class SketchBuilder<B extends SketchBuilder<B>>
{
  public static final int DEFAULT_RESIZE_FACTOR = 8;

  private int lgK = ThetaConstants.DEFAULT_LG_K;
  private Integer lgStartingSize; // derived from lgK and the resize factor when unset
  private int resizeFactor = DEFAULT_RESIZE_FACTOR;
  private double samplingProbability = 1.0;
  private long seed = ThetaConstants.DEFAULT_SEED;
  private EntryAllocator allocator = EntryAllocator.HEAP;

  SketchBuilder()
  {
  }

  /**
   * @param lgK log2 of the nominal number of retained entries; the relative error of an
   *            estimate is about {@code 1 / sqrt(2^lgK)}
   */
  public B setLgK(int lgK)
  {
    checkContract(
        lgK >= ThetaConstants.MIN_LG_K && lgK <= ThetaConstants.MAX_LG_K,
        "lgK must be in [%s, %s]: %s",
        ThetaConstants.MIN_LG_K,
        ThetaConstants.MAX_LG_K,
        lgK
    );
    this.lgK = lgK;
    return self();
  }

  /**
   * @param lgStartingSize log2 of the initial table size, at most {@code lgK + 1}
   */
  public B setLgStartingSize(int lgStartingSize)
  {
    checkContract(
        lgStartingSize >= ThetaConstants.MIN_LG_SIZE,
        "lgStartingSize must be at least %s: %s",
        ThetaConstants.MIN_LG_SIZE,
        lgStartingSize
    );
    this.lgStartingSize = lgStartingSize;
    return self();
  }

  /**
   * @param resizeFactor how many times larger the table gets on each resize: 1, 2, 4 or 8
   */
  public B setResizeFactor(int resizeFactor)
  {
    checkContract(
        resizeFactor >= 1 && resizeFactor <= 8 && Integer.bitCount(resizeFactor) == 1,
        "resizeFactor must be 1, 2, 4 or 8: %s",
        resizeFactor
    );
    this.resizeFactor = resizeFactor;
    return self();
  }

  /**
   * @param samplingProbability items are pre-sampled with this probability, in (0, 1]
   */
  public B setSamplingProbability(double samplingProbability)
  {
    checkContract(
        samplingProbability > 0.0 && samplingProbability <= 1.0,
        "samplingProbability must be in (0, 1]: %s",
        samplingProbability
    );
    // a starting theta of 0 would discard every item
    checkContract(
        toTheta(samplingProbability) > 0,
        "samplingProbability is too small to sample anything: %s",
        samplingProbability
    );
    this.samplingProbability = samplingProbability;
    return self();
  }

  public B setSeed(long seed)
  {
    this.seed = seed;
    return self();
  }

  public B setAllocator(EntryAllocator allocator)
  {
    this.allocator = Preconditions.checkNotNull(allocator, "allocator");
    return self();
  }

  public int getLgK()
  {
    return lgK;
  }

  public int getResizeFactor()
  {
    return resizeFactor;
  }

  public double getSamplingProbability()
  {
    return samplingProbability;
  }

  public long getSeed()
  {
    return seed;
  }

  /**
   * @return the configured starting size, or the largest size below the ceiling from which
   * repeated resizing lands exactly on the ceiling
   */
  public int getLgStartingSize()
  {
    if (lgStartingSize != null) {
      return lgStartingSize;
    }
    final int lgMaxSize = lgK + 1;
    final int lgResizeFactor = Integer.numberOfTrailingZeros(resizeFactor);
    if (lgMaxSize <= ThetaConstants.MIN_LG_SIZE || lgResizeFactor == 0) {
      return lgMaxSize;
    }
    return (lgMaxSize - ThetaConstants.MIN_LG_SIZE) % lgResizeFactor + ThetaConstants.MIN_LG_SIZE;
  }

  long getStartingTheta()
  {
    return toTheta(samplingProbability);
  }

  private static long toTheta(double samplingProbability)
  {
    if (samplingProbability >= 1.0) {
      return ThetaConstants.MAX_THETA;
    }
    return (long) (samplingProbability * ThetaConstants.MAX_THETA);
  }

  <S> EntryTable<S> newTable(boolean withSummaries)
  {
    final int lgStart = getLgStartingSize();
    checkContract(
        lgStart <= lgK + 1,
        "lgStartingSize %s exceeds the table ceiling lgK + 1 = %s",
        lgStart,
        lgK + 1
    );
    checkContract(
        resizeFactor > 1 || lgStart == lgK + 1,
        "a table that never resizes must start at lgK + 1 = %s, not %s",
        lgK + 1,
        lgStart
    );
    return new EntryTable<>(
        lgStart,
        lgK,
        Integer.numberOfTrailingZeros(resizeFactor),
        getStartingTheta(),
        withSummaries,
        allocator
    );
  }

  B copyFrom(SketchBuilder<?> that)
  {
    this.lgK = that.lgK;
    this.lgStartingSize = that.lgStartingSize;
    this.resizeFactor = that.resizeFactor;
    this.samplingProbability = that.samplingProbability;
    this.seed = that.seed;
    this.allocator = that.allocator;
    return self();
  }

  short seedHash()
  {
    return SketchHashing.computeSeedHash(seed);
  }

  abstract B self();
}
