package io.thetafun.sketch;

import org.testng.Assert;
import org.testng.annotations.Test;

public class SketchBenchmarkTest
{
  @Test
  public void testResultLayout()
  {
    long[] cards = {10, 100};
    long[][] result = new SketchBenchmark().benchmark(cards, "theta8", "theta10x2");
    Assert.assertEquals(result.length, 2);
    for (int i = 0; i < result.length; i++) {
      Assert.assertEquals(result[i].length, 5);
      Assert.assertEquals(result[i][0], cards[i]);
      for (int j = 1; j < result[i].length; j++) {
        Assert.assertTrue(result[i][j] >= 0);
      }
    }
  }
}
