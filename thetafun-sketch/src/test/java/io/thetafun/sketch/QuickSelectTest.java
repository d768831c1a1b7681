package io.thetafun.sketch;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Random;

public class QuickSelectTest
{
  @Test
  public void testSelectMatchesSortedOrder()
  {
    Random random = new Random(31);
    for (int trial = 0; trial < 50; trial++) {
      int length = 1 + random.nextInt(500);
      long[] values = new long[length];
      for (int i = 0; i < length; i++) {
        values[i] = random.nextLong() >>> 1;
      }
      long[] sorted = values.clone();
      Arrays.sort(sorted);

      int index = random.nextInt(length);
      long selected = QuickSelect.select(values, length, index);
      Assert.assertEquals(selected, sorted[index]);
      for (int i = 0; i < index; i++) {
        Assert.assertTrue(values[i] <= selected);
      }
      for (int i = index + 1; i < length; i++) {
        Assert.assertTrue(values[i] >= selected);
      }
    }
  }

  @Test
  public void testSelectWithDuplicates()
  {
    long[] values = {5, 1, 5, 5, 2, 5, 1};
    Assert.assertEquals(QuickSelect.select(values, values.length, 0), 1L);
    Assert.assertEquals(QuickSelect.select(values.clone(), values.length, 2), 2L);
    Assert.assertEquals(QuickSelect.select(values.clone(), values.length, 6), 5L);
  }

  @Test
  public void testSelectOnlyLooksAtPrefix()
  {
    long[] values = {9, 3, 7, 0, 0, 0};
    Assert.assertEquals(QuickSelect.select(values, 3, 0), 3L);
  }

  @Test(expectedExceptions = IndexOutOfBoundsException.class)
  public void testIndexOutOfRange()
  {
    QuickSelect.select(new long[]{1, 2, 3}, 3, 3);
  }
}
