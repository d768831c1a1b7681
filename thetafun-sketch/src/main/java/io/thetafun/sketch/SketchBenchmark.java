package io.thetafun.sketch;

import com.google.common.base.Joiner;
import com.google.common.base.Supplier;
import com.google.common.primitives.Longs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Measures the average cost of {@link UpdateThetaSketch#update(long)} per item, and of merging
 * a compact sketch of that many items into a union.
 */
public class SketchBenchmark
{
  private static final Logger LOG = LoggerFactory.getLogger(SketchBenchmark.class);

  private static final long[] CARDS = {100, 1000, 10000, 100000, 1000000, 10000000};

  private long ingest(
      Supplier<UpdateThetaSketch> sketchSupplier,
      final int card,
      final int warmUps,
      final int runs
  )
  {
    for (int i = 0; i < warmUps; i++) {
      fill(sketchSupplier.get(), card);
    }

    long totalNanos = 0;
    for (int i = 0; i < runs; i++) {
      UpdateThetaSketch sketch = sketchSupplier.get();
      long start = System.nanoTime();
      fill(sketch, card);
      totalNanos += System.nanoTime() - start;
    }

    return (totalNanos / runs) / card;
  }

  private long merge(
      Supplier<UpdateThetaSketch> sketchSupplier,
      final int card,
      final int warmUps,
      final int runs
  )
  {
    UpdateThetaSketch sketch = sketchSupplier.get();
    fill(sketch, card);
    CompactThetaSketch compact = sketch.compact();

    for (int i = 0; i < warmUps; i++) {
      unionOf(sketch.getLgK(), compact);
    }

    long totalNanos = 0;
    for (int i = 0; i < runs; i++) {
      long start = System.nanoTime();
      unionOf(sketch.getLgK(), compact);
      totalNanos += System.nanoTime() - start;
    }
    return totalNanos / runs;
  }

  private static void fill(UpdateThetaSketch sketch, int card)
  {
    for (int c = 0; c < card; c++) {
      sketch.update(c);
    }
  }

  private static CompactThetaSketch unionOf(int lgK, CompactThetaSketch compact)
  {
    ThetaUnion union = ThetaUnion.builder().setLgK(lgK).build();
    union.update(compact);
    return union.getResult();
  }

  /**
   * @return result[i] = [card, updateNanosPerItem(name1), mergeNanos(name1), updateNanosPerItem(name2), ..]
   */
  public long[][] benchmark(long[] cards, String... sketchNames)
  {
    long[][] result = new long[cards.length][];
    for (int i = 0; i < result.length; i++) {
      result[i] = new long[1 + 2 * sketchNames.length];
      result[i][0] = cards[i];
    }

    for (int i = 0; i < sketchNames.length; i++) {
      final String name = sketchNames[i];
      final Supplier<UpdateThetaSketch> supplier = Sketches.lazyGet(name, ThetaConstants.DEFAULT_SEED);
      for (int j = 0; j < result.length; j++) {
        final int card = (int) result[j][0];
        LOG.info("Test sketch {} card {}", name, card);
        result[j][2 * i + 1] = ingest(supplier, card, 10, 20);
        result[j][2 * i + 2] = merge(supplier, card, 10, 20);
      }
    }

    return result;
  }

  public static void main(String[] args) throws IOException
  {
    // args: <sketchName>..
    if (args.length < 1) {
      System.err.println("Arguments: <sketchName>..");
      System.exit(1);
    }

    SketchBenchmark benchmark = new SketchBenchmark();
    long[][] result = benchmark.benchmark(CARDS, args);

    Path outFile = Paths.get("speed_" + Joiner.on("_").join(args) + ".tsv");
    LOG.info("Writing results to {}", outFile);
    try (BufferedWriter writer = Files.newBufferedWriter(outFile)) {
      // header: card update(name1) merge(name1) ..
      writer.write("Card");
      for (String name : args) {
        writer.write("\tupdate(" + name + ")\tmerge(" + name + ")");
      }
      writer.write("\n");

      for (long[] row : result) {
        writer.write(Joiner.on('\t').join(Longs.asList(row)));
        writer.write("\n");
      }
    }
  }
}
