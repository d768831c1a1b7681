package io.thetafun.sketch;

public final class ThetaConstants
{
  /**
   * Sketch hashes are 63-bit, so theta lives in [0, Long.MAX_VALUE] and
   * signed comparisons between hashes and theta are safe.
   */
  public static final long MAX_THETA = Long.MAX_VALUE;

  public static final long DEFAULT_SEED = 9001L;

  public static final int DEFAULT_LG_K = 12;
  public static final int MIN_LG_K = 4;
  public static final int MAX_LG_K = 26;

  // smallest table a sketch ever allocates
  public static final int MIN_LG_SIZE = 5;

  // load thresholds: below the ceiling the table grows once half full,
  // at the ceiling it is rebuilt once three quarters full
  public static final double RESIZE_THRESHOLD = 0.5;
  public static final double REBUILD_THRESHOLD = 0.75;

  private ThetaConstants()
  {
  }
}
