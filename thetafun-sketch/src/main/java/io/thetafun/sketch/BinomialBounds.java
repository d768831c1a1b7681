package io.thetafun.sketch;

import com.google.common.base.Preconditions;

/**
 * Continuity-corrected normal approximation of the binomial sampling bounds.
 *
 * <p>Solves {@code |n - theta * N| = k * sqrt(N * theta * (1 - theta))} for the population size
 * {@code N}, with {@code n} shifted by half a sample towards the bound being computed. Lower
 * bounds never drop below the number of samples and never exceed the estimate; upper bounds
 * never drop below the estimate.
 */
public final class BinomialBounds
{
  public static final BinomialBounds INSTANCE = new BinomialBounds();

  // one-sided tail probability of a standard normal at 1, 2 and 3 standard deviations
  private static final double[] DELTA_OF_NUM_STD_DEVS = {
      0.0, 0.15865525393145705, 0.02275013194817921, 0.0013498980316301035
  };

  private BinomialBounds()
  {
  }

  /**
   * @return a lower bound on the population size, given {@code numSamples} items sampled with
   * probability {@code samplingFraction}
   */
  public double getLowerBound(long numSamples, double samplingFraction, int numStdDevs)
  {
    checkArguments(numSamples, samplingFraction, numStdDevs);
    if (samplingFraction == 1.0 || numSamples == 0) {
      return numSamples;
    }
    final double estimate = numSamples / samplingFraction;
    final double lb = continuousLowerBound(numSamples, samplingFraction, numStdDevs);
    return Math.min(estimate, Math.max(numSamples, lb));
  }

  public double getUpperBound(long numSamples, double samplingFraction, int numStdDevs)
  {
    checkArguments(numSamples, samplingFraction, numStdDevs);
    if (samplingFraction == 1.0) {
      return numSamples;
    }
    if (numSamples == 0) {
      // smallest N for which seeing nothing has probability at most delta
      return Math.log(DELTA_OF_NUM_STD_DEVS[numStdDevs]) / Math.log1p(-samplingFraction);
    }
    final double estimate = numSamples / samplingFraction;
    return Math.max(estimate, continuousUpperBound(numSamples, samplingFraction, numStdDevs));
  }

  private static double continuousLowerBound(long numSamples, double theta, int numStdDevs)
  {
    final double nHat = (numSamples - 0.5) / theta;
    final double b = numStdDevs * Math.sqrt((1.0 - theta) / theta);
    final double d = 0.5 * b * Math.sqrt((b * b) + (4.0 * nHat));
    final double center = nHat + (0.5 * b * b);
    return center - d;
  }

  private static double continuousUpperBound(long numSamples, double theta, int numStdDevs)
  {
    final double nHat = (numSamples + 0.5) / theta;
    final double b = numStdDevs * Math.sqrt((1.0 - theta) / theta);
    final double d = 0.5 * b * Math.sqrt((b * b) + (4.0 * nHat));
    final double center = nHat + (0.5 * b * b);
    return center + d;
  }

  private static void checkArguments(long numSamples, double samplingFraction, int numStdDevs)
  {
    Preconditions.checkArgument(numSamples >= 0, "numSamples must be non-negative: %s", numSamples);
    Preconditions.checkArgument(
        samplingFraction > 0.0 && samplingFraction <= 1.0,
        "samplingFraction must be in (0, 1]: %s",
        samplingFraction
    );
    Preconditions.checkArgument(
        numStdDevs >= 1 && numStdDevs <= 3,
        "numStdDevs must be 1, 2 or 3: %s",
        numStdDevs
    );
  }
}
