package io.thetafun.sketch;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.HashSet;
import java.util.Set;

public class RandomIdGeneratorTest
{
  @Test
  public void testSameSeedSameSequence()
  {
    RandomIdGenerator a = new RandomIdGenerator(11L);
    RandomIdGenerator b = new RandomIdGenerator(11L);
    for (int i = 0; i < 100; i++) {
      byte[] id = a.generate();
      Assert.assertEquals(id.length, 20);
      Assert.assertEquals(id, b.generate());
    }
  }

  @Test
  public void testIdsAreDistinct()
  {
    RandomIdGenerator generator = new RandomIdGenerator(3L);
    Set<Long> seen = new HashSet<>();
    for (int i = 0; i < 10000; i++) {
      Assert.assertTrue(seen.add(generator.nextLong()));
    }
    Assert.assertNotEquals(new RandomIdGenerator(1L).nextLong(), new RandomIdGenerator(2L).nextLong());
  }
}
