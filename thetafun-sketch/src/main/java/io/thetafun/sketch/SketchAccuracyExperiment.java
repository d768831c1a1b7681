package io.thetafun.sketch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Measures the relative error of sharded ingestion followed by a union: the stream of distinct
 * ids is dealt round-robin to {@code shards} update sketches, which are compacted and unioned
 * at every checkpoint.
 */
public class SketchAccuracyExperiment
{
  private static final Logger LOG = LoggerFactory.getLogger(SketchAccuracyExperiment.class);

  private static final int DEFAULT_SHARDS = 1;

  /**
   * Run estimation on random generated data set of cardinality {1*fromCard, 2*fromCard, 3*fromCard, .., toCard}.
   * `numRuns` experiments will be run for each cardinality, each with its own hash seed.
   *
   * @return errors for each experiment in percent, errors[i][j] = error at cardinality (i+1)*fromCard of the j-th run.
   */
  static double[][] measureErrors(
      String sketchName,
      final int fromCard,
      final int toCard,
      final int numRuns,
      final int numShards,
      final Random random
  )
  {
    final int numCard = toCard / fromCard;
    double[][] errors = new double[numCard][numRuns];

    for (int run = 0; run < numRuns; run++) {
      final long seed = random.nextLong();
      final RandomIdGenerator ids = new RandomIdGenerator(random.nextLong());
      final UpdateThetaSketch[] shards = new UpdateThetaSketch[numShards];
      for (int i = 0; i < numShards; i++) {
        shards[i] = Sketches.get(sketchName, seed);
      }
      final long start = System.currentTimeMillis();

      // estimate cardinality of 1*fromCard, 2*fromCard, 3*fromCard, .., toCard
      for (int card = 1; card <= toCard; card++) {
        shards[card % numShards].update(ids.generate());

        if (card % fromCard == 0) {
          double est = union(shards, seed).getEstimate();
          double error = 100.0 * (est - card) / card;
          errors[card / fromCard - 1][run] = Math.abs(error);
        }
      }
      LOG.info("Finish run #{} in {} ms", run, System.currentTimeMillis() - start);
    }
    return errors;
  }

  private static CompactThetaSketch union(UpdateThetaSketch[] shards, long seed)
  {
    ThetaUnion union = ThetaUnion.builder()
                                 .setLgK(shards[0].getLgK())
                                 .setSeed(seed)
                                 .build();
    for (UpdateThetaSketch shard : shards) {
      union.update(shard.compact());
    }
    return union.getResult();
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 4 || args.length > 6) {
      System.err.println("Arguments: <sketch> <from> <to> <runs> [<shards>] [<outFile>]");
      System.exit(1);
    }

    final String sketchName = args[0];
    final int fromCard = Integer.parseInt(args[1]);
    final int toCard = Integer.parseInt(args[2]);
    final int numRuns = Integer.parseInt(args[3]);
    final int numShards = args.length > 4 ? Integer.parseInt(args[4]) : DEFAULT_SHARDS;
    if (toCard <= fromCard || toCard % fromCard != 0) {
      throw new IllegalArgumentException("illegal from \"" + fromCard + "\" and to \"" + toCard + "\"");
    }
    if (numShards < 1) {
      throw new IllegalArgumentException("illegal shards \"" + numShards + "\"");
    }

    Path outFile;
    if (args.length == 6) {
      outFile = Paths.get(args[5]);
    } else {
      outFile = Paths.get(String.format("%s_%d_%d_%d_%d.tsv", sketchName, fromCard, toCard, numRuns, numShards));
    }

    final double[][] errors = measureErrors(sketchName, fromCard, toCard, numRuns, numShards, new Random());
    // compute min, 50%, max error for each cardinality
    List<OneResult> results = new ArrayList<>(errors.length);
    for (int i = 0; i < errors.length; i++) {
      long cardinality = (long) (i + 1) * fromCard;
      results.add(OneResult.from(cardinality, errors[i]));
    }

    LOG.info("Writing results to {}", outFile);
    try (BufferedWriter writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
      writer.write("Card\tMin\tMedian\tMax\n");
      for (OneResult result : results) {
        writer.write(String.format(
            "%d\t%.3f\t%.3f\t%.3f\n",
            result.cardinality,
            result.minError,
            result.medianError,
            result.maxError
        ));
      }
    }
  }

  static class OneResult
  {
    final long cardinality;
    final double minError;
    final double medianError;
    final double maxError;

    OneResult(long cardinality, double minError, double medianError, double maxError)
    {
      this.cardinality = cardinality;
      this.minError = minError;
      this.medianError = medianError;
      this.maxError = maxError;
    }

    static OneResult from(long cardinality, double[] errors)
    {
      double[] sorted = errors.clone();
      Arrays.sort(sorted);
      return new OneResult(
          cardinality,
          sorted[0],
          sorted[sorted.length / 2],
          sorted[sorted.length - 1]
      );
    }
  }
}
