package io.thetafun.sketch;

import org.testng.Assert;
import org.testng.annotations.Test;

public class UnionStateTest
{
  private static UpdateThetaSketch sketchOf(int lgK, int from, int to)
  {
    UpdateThetaSketch sketch = UpdateThetaSketch.builder().setLgK(lgK).build();
    for (int i = from; i < to; i++) {
      sketch.update(i);
    }
    return sketch;
  }

  private static void assertAllBelowTheta(UnionState<?> state, EntryTable<?> table)
  {
    for (long key : table.keys()) {
      if (key != 0) {
        Assert.assertTrue(key < state.getUnionTheta());
      }
    }
  }

  @Test
  public void testRetainedEntriesStayBelowUnionTheta()
  {
    EntryTable<Void> table = ThetaUnion.builder().setLgK(8).newTable(false);
    UnionState<Void> state = new UnionState<>(table, SketchHashing.computeSeedHash(ThetaConstants.DEFAULT_SEED), null);

    // without a merge policy the state updates this table in place
    // exact input first, then inputs whose theta keeps dropping
    state.update(sketchOf(12, 0, 300));
    Assert.assertEquals(state.getUnionTheta(), ThetaConstants.MAX_THETA);
    Assert.assertEquals(state.getNumEntries(), 300);
    assertAllBelowTheta(state, table);

    long previous = state.getUnionTheta();
    for (int lgK = 10; lgK >= 6; lgK--) {
      UpdateThetaSketch sketch = sketchOf(lgK, 0, 5000);
      state.update(sketch);
      Assert.assertTrue(state.getUnionTheta() <= Math.min(previous, sketch.getTheta64()));
      Assert.assertTrue(state.getNumEntries() <= EntryTable.capacity(9, 8));
      assertAllBelowTheta(state, table);
      previous = state.getUnionTheta();
    }
    Assert.assertFalse(state.isEmpty());
  }

  @Test
  public void testResultDoesNotExceedNominalSize()
  {
    EntryTable<Void> table = ThetaUnion.builder().setLgK(6).newTable(false);
    UnionState<Void> state = new UnionState<>(table, SketchHashing.computeSeedHash(ThetaConstants.DEFAULT_SEED), null);
    state.update(sketchOf(12, 0, 1000));

    CompactEntries entries = state.getResult(true);
    Assert.assertEquals(entries.size(), 64);
    Assert.assertTrue(entries.theta <= state.getUnionTheta());
    for (int i = 0; i < entries.size(); i++) {
      Assert.assertTrue(entries.keys[i] < entries.theta);
      if (i > 0) {
        Assert.assertTrue(entries.keys[i - 1] < entries.keys[i]);
      }
    }
  }
}
