package io.thetafun.sketch;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ThetaUnionTest
{
  private static UpdateThetaSketch sketchOf(int lgK, long seed, int from, int to)
  {
    UpdateThetaSketch sketch = UpdateThetaSketch.builder().setLgK(lgK).setSeed(seed).build();
    for (int i = from; i < to; i++) {
      sketch.update(i);
    }
    return sketch;
  }

  private static UpdateThetaSketch sketchOf(int lgK, int from, int to)
  {
    return sketchOf(lgK, ThetaConstants.DEFAULT_SEED, from, to);
  }

  private static ThetaUnion union(int lgK)
  {
    return ThetaUnion.builder().setLgK(lgK).build();
  }

  private static CompactThetaSketch unionOf(int lgK, Sketch<?>... sketches)
  {
    ThetaUnion union = union(lgK);
    for (Sketch<?> sketch : sketches) {
      union.update(sketch);
    }
    return union.getResult();
  }

  @Test
  public void testEmptyUnion()
  {
    CompactThetaSketch result = union(10).getResult();
    Assert.assertTrue(result.isEmpty());
    Assert.assertTrue(result.isOrdered());
    Assert.assertEquals(result.getNumRetained(), 0);
    Assert.assertEquals(result.getTheta64(), ThetaConstants.MAX_THETA);
    Assert.assertEquals(result.getEstimate(), 0.0);
  }

  @Test
  public void testExactUnionOfOverlappingSketches()
  {
    CompactThetaSketch result = unionOf(10, sketchOf(10, 0, 100), sketchOf(10, 50, 150).compact());
    Assert.assertFalse(result.isEmpty());
    Assert.assertFalse(result.isEstimationMode());
    Assert.assertEquals(result.getEstimate(), 150.0);
    Assert.assertEquals(result.getLowerBound(2), 150.0);
    Assert.assertEquals(result.getUpperBound(2), 150.0);
  }

  @Test
  public void testUnionIsCommutative()
  {
    UpdateThetaSketch a = sketchOf(10, 0, 6000);
    UpdateThetaSketch b = sketchOf(10, 3000, 9000);

    CompactThetaSketch ab = unionOf(10, a, b);
    CompactThetaSketch ba = unionOf(10, b, a);
    Assert.assertTrue(ab.isEstimationMode());
    Assert.assertEquals(ab.getTheta64(), ba.getTheta64());
    Assert.assertEquals(ab.getHashes(), ba.getHashes());
    Assert.assertEquals(ab.getEstimate(), ba.getEstimate(), 1e-9);
    Assert.assertEquals(ab.getEstimate(), 9000, 900);
  }

  @Test
  public void testUnionIsAssociative()
  {
    UpdateThetaSketch a = sketchOf(9, 0, 3000);
    UpdateThetaSketch b = sketchOf(9, 2000, 7000);
    UpdateThetaSketch c = sketchOf(9, 10000, 10300);

    CompactThetaSketch left = unionOf(9, unionOf(9, a, b), c);
    CompactThetaSketch right = unionOf(9, a, unionOf(9, b, c));
    Assert.assertEquals(left.getTheta64(), right.getTheta64());
    Assert.assertEquals(left.getHashes(), right.getHashes());
    Assert.assertEquals(left.getEstimate(), right.getEstimate(), 1e-9);
  }

  @Test
  public void testResultIsLimitedToNominalSize()
  {
    CompactThetaSketch result = unionOf(8, sketchOf(10, 0, 1000), sketchOf(10, 1000, 1200));
    Assert.assertEquals(result.getNumRetained(), 256);
    Assert.assertTrue(result.isEstimationMode());
    for (long hash : result) {
      Assert.assertTrue(hash < result.getTheta64());
    }
    Assert.assertEquals(result.getEstimate(), 1200, 240);
  }

  @Test
  public void testThetaNeverIncreases()
  {
    ThetaUnion union = union(10);
    long previous = union.getResult().getTheta64();
    for (int i = 0; i < 10; i++) {
      union.update(sketchOf(10, i * 1000, i * 1000 + 3000));
      CompactThetaSketch result = union.getResult();
      Assert.assertTrue(result.getTheta64() <= previous);
      for (long hash : result) {
        Assert.assertTrue(hash < result.getTheta64());
      }
      previous = result.getTheta64();
    }
    // a small exact sketch afterwards cannot raise theta again
    union.update(sketchOf(10, 0, 10));
    Assert.assertTrue(union.getResult().getTheta64() <= previous);
  }

  @Test
  public void testGetResultIsNonDestructive()
  {
    ThetaUnion union = union(12);
    union.update(sketchOf(12, 0, 100));
    CompactThetaSketch first = union.getResult();
    CompactThetaSketch again = union.getResult(false);
    Assert.assertEquals(again.getNumRetained(), 100);
    Assert.assertFalse(again.isOrdered());

    union.update(sketchOf(12, 100, 300));
    CompactThetaSketch second = union.getResult();
    Assert.assertEquals(first.getEstimate(), 100.0);
    Assert.assertEquals(second.getEstimate(), 300.0);
  }

  @Test
  public void testOrderedAndUnorderedInputsAgree()
  {
    UpdateThetaSketch a = sketchOf(9, 0, 4000);
    UpdateThetaSketch b = sketchOf(11, 1000, 2000);

    CompactThetaSketch fromOrdered = unionOf(10, a.compact(true), b.compact(true));
    CompactThetaSketch fromUnordered = unionOf(10, a.compact(false), b.compact(false));
    Assert.assertEquals(fromOrdered.getTheta64(), fromUnordered.getTheta64());
    Assert.assertEquals(fromOrdered.getHashes(), fromUnordered.getHashes());
  }

  @Test
  public void testEmptySketchDoesNotLowerTheta()
  {
    UpdateThetaSketch sampled = UpdateThetaSketch.builder().setSamplingProbability(0.1).build();
    ThetaUnion union = ThetaUnion.builder().build();
    union.update(sampled);
    union.update(sketchOf(12, 0, 10));
    CompactThetaSketch result = union.getResult();
    Assert.assertEquals(result.getTheta64(), ThetaConstants.MAX_THETA);
    Assert.assertEquals(result.getEstimate(), 10.0);
  }

  @Test
  public void testSampledSketchLowersTheta()
  {
    UpdateThetaSketch sampled = UpdateThetaSketch.builder().setSamplingProbability(0.5).build();
    for (int i = 0; i < 1000; i++) {
      sampled.update(i);
    }
    CompactThetaSketch result = unionOf(12, sketchOf(12, 0, 1000), sampled);
    Assert.assertEquals(result.getTheta64(), sampled.getTheta64());
    Assert.assertEquals(result.getNumRetained(), sampled.getNumRetained());
  }

  @Test
  public void testSeedMismatchIsRejected()
  {
    ThetaUnion union = union(10);
    union.update(sketchOf(10, 0, 100));
    try {
      union.update(sketchOf(10, 1234L, 100, 200));
      Assert.fail();
    }
    catch (SketchContractException e) {
      Assert.assertTrue(e.getMessage().contains("incompatible seed hashes"));
    }
    Assert.assertEquals(union.getResult().getEstimate(), 100.0);
  }

  @Test(expectedExceptions = SketchContractException.class)
  public void testUnionWithOtherSeedRejectsDefaultSketch()
  {
    ThetaUnion union = ThetaUnion.builder().setSeed(77).build();
    union.update(sketchOf(10, 0, 10));
  }

  @Test
  public void testUnionAcceptsTupleSketches()
  {
    UpdateTupleSketch<Integer> tuple = UpdateTupleSketch.builder(MergePolicy.sumOfIntegers()).build();
    for (int i = 0; i < 100; i++) {
      tuple.update((long) i, 1);
    }
    CompactThetaSketch result = unionOf(12, tuple, sketchOf(12, 50, 150));
    Assert.assertEquals(result.getEstimate(), 150.0);
  }

  @Test
  public void testReset()
  {
    ThetaUnion union = union(10);
    union.update(sketchOf(10, 0, 5000));
    union.reset();
    CompactThetaSketch result = union.getResult();
    Assert.assertTrue(result.isEmpty());
    Assert.assertEquals(result.getTheta64(), ThetaConstants.MAX_THETA);

    union.update(sketchOf(10, 0, 10));
    Assert.assertEquals(union.getResult().getEstimate(), 10.0);
  }

  @Test
  public void testBuilderChangesAfterBuildDoNotAffectReset()
  {
    ThetaUnion.Builder builder = ThetaUnion.builder().setLgK(10);
    ThetaUnion union = builder.build();
    builder.setSeed(5);
    union.reset();
    union.update(sketchOf(10, 0, 10));
    Assert.assertEquals(union.getResult().getEstimate(), 10.0);
  }

  @Test
  public void testDisjointUnionAccuracy()
  {
    final int trials = 20;
    int withinFivePercent = 0;
    for (long seed = 1; seed <= trials; seed++) {
      UpdateThetaSketch a = sketchOf(12, seed, 0, 10000);
      UpdateThetaSketch b = sketchOf(12, seed, 10000, 20000);
      ThetaUnion union = ThetaUnion.builder().setLgK(12).setSeed(seed).build();
      union.update(a.compact());
      union.update(b.compact());
      double estimate = union.getResult().getEstimate();
      if (Math.abs(estimate - 20000) <= 0.05 * 20000) {
        withinFivePercent++;
      }
    }
    Assert.assertTrue(withinFivePercent >= 0.95 * trials, withinFivePercent + " of " + trials);
  }
}
