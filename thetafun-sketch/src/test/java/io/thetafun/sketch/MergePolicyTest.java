package io.thetafun.sketch;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Comparator;

public class MergePolicyTest
{
  @Test
  public void testSums()
  {
    Assert.assertEquals(MergePolicy.sumOfIntegers().merge(3, 4), Integer.valueOf(7));
    Assert.assertEquals(MergePolicy.sumOfLongs().merge(3L, 4L), Long.valueOf(7));
    Assert.assertEquals(MergePolicy.sumOfDoubles().merge(0.5, 0.25).doubleValue(), 0.75, 1e-12);
  }

  @Test
  public void testKeepFirst()
  {
    Assert.assertEquals(MergePolicy.<String>keepFirst().merge("a", "b"), "a");
  }

  @Test
  public void testMaxOf()
  {
    MergePolicy<String> longest = MergePolicy.maxOf(Comparator.comparingInt(String::length));
    Assert.assertEquals(longest.merge("ab", "abc"), "abc");
    Assert.assertEquals(longest.merge("abc", "ab"), "abc");
    // ties keep the retained summary
    Assert.assertEquals(longest.merge("ab", "cd"), "ab");
  }
}
