package io.thetafun.sketch;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;

import java.util.Iterator;

/**
 * Read side shared by update and compact sketches.
 *
 * <p>Iterating a sketch visits every retained entry once; each call to {@link #iterator()} starts
 * an independent traversal. Update sketches must not be modified while being iterated.
 *
 * @param <E> type of a retained entry: the hash for theta sketches, a {@link TupleEntry} for
 *            tuple sketches
 */
public abstract class Sketch<E> implements Iterable<E>
{
  Sketch()
  {
  }

  public abstract boolean isEmpty();

  public abstract boolean isOrdered();

  /**
   * @return theta as a raw value in [0, {@link ThetaConstants#MAX_THETA}]
   */
  public abstract long getTheta64();

  public abstract int getNumRetained();

  public abstract short getSeedHash();

  public boolean isEstimationMode()
  {
    return getTheta64() < ThetaConstants.MAX_THETA && !isEmpty();
  }

  /**
   * @return theta as a sampling fraction in (0, 1]
   */
  public double getTheta()
  {
    return (double) getTheta64() / ThetaConstants.MAX_THETA;
  }

  public double getEstimate()
  {
    return getNumRetained() / getTheta();
  }

  /**
   * @param numStdDevs 1, 2 or 3 for roughly 68%, 95% or 99.7% confidence
   */
  public double getLowerBound(int numStdDevs)
  {
    checkNumStdDevs(numStdDevs);
    if (!isEstimationMode()) {
      return getNumRetained();
    }
    return BinomialBounds.INSTANCE.getLowerBound(getNumRetained(), getTheta(), numStdDevs);
  }

  /**
   * @param numStdDevs 1, 2 or 3 for roughly 68%, 95% or 99.7% confidence
   */
  public double getUpperBound(int numStdDevs)
  {
    checkNumStdDevs(numStdDevs);
    if (!isEstimationMode()) {
      return getNumRetained();
    }
    return BinomialBounds.INSTANCE.getUpperBound(getNumRetained(), getTheta(), numStdDevs);
  }

  @Override
  public Iterator<E> iterator()
  {
    final long[] keys = keys();
    final Object[] summaries = summaries();
    return new AbstractIterator<E>()
    {
      private int index;

      @Override
      protected E computeNext()
      {
        while (index < keys.length) {
          final int i = index++;
          if (keys[i] != 0) {
            return toEntry(keys[i], summaries == null ? null : summaries[i]);
          }
        }
        return endOfData();
      }
    };
  }

  @Override
  public String toString()
  {
    return toString(false);
  }

  /**
   * @param detail whether to list every retained entry after the summary
   */
  public String toString(boolean detail)
  {
    StringBuilder sb = new StringBuilder();
    sb.append("### ").append(getClass().getSimpleName()).append(" summary:\n");
    sb.append(String.format("   num retained entries : %d%n", getNumRetained()));
    sb.append(String.format("   seed hash            : %d%n", Short.toUnsignedInt(getSeedHash())));
    sb.append(String.format("   empty?               : %b%n", isEmpty()));
    sb.append(String.format("   ordered?             : %b%n", isOrdered()));
    sb.append(String.format("   estimation mode?     : %b%n", isEstimationMode()));
    sb.append(String.format("   theta (fraction)     : %f%n", getTheta()));
    sb.append(String.format("   theta (raw 64-bit)   : %d%n", getTheta64()));
    sb.append(String.format("   estimate             : %f%n", getEstimate()));
    sb.append(String.format("   lower bound 95%% conf : %f%n", getLowerBound(2)));
    sb.append(String.format("   upper bound 95%% conf : %f%n", getUpperBound(2)));
    appendSpecifics(sb);
    sb.append("### End sketch summary\n");
    if (detail) {
      sb.append("### Retained entries\n");
      for (E entry : this) {
        sb.append(entry).append('\n');
      }
      sb.append("### End retained entries\n");
    }
    return sb.toString();
  }

  void appendSpecifics(StringBuilder sb)
  {
  }

  // slot arrays; 0 marks an unused slot. Callers in this package only read them.
  abstract long[] keys();

  // null for sketches without summaries
  abstract Object[] summaries();

  abstract E toEntry(long key, Object summary);

  private static void checkNumStdDevs(int numStdDevs)
  {
    Preconditions.checkArgument(
        numStdDevs >= 1 && numStdDevs <= 3,
        "numStdDevs must be 1, 2 or 3: %s",
        numStdDevs
    );
  }
}
