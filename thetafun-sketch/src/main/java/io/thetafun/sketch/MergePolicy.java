package io.thetafun.sketch;

import com.google.common.base.Preconditions;

import java.util.Comparator;

/**
 * Combines the summary already retained for a hash with an incoming summary for the same hash.
 *
 * <p>Implementations must be pure: no side effects and no mutation of either argument. Union
 * results are independent of the input order only if the policy is also commutative and
 * associative.
 */
@FunctionalInterface
public interface MergePolicy<S>
{
  S merge(S existing, S incoming);

  static MergePolicy<Integer> sumOfIntegers()
  {
    return Integer::sum;
  }

  static MergePolicy<Long> sumOfLongs()
  {
    return Long::sum;
  }

  static MergePolicy<Double> sumOfDoubles()
  {
    return Double::sum;
  }

  static <S> MergePolicy<S> keepFirst()
  {
    return (existing, incoming) -> existing;
  }

  static <S> MergePolicy<S> maxOf(Comparator<? super S> comparator)
  {
    Preconditions.checkNotNull(comparator, "comparator");
    return (existing, incoming) -> comparator.compare(incoming, existing) > 0 ? incoming : existing;
  }
}
