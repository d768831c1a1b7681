package io.thetafun.sketch;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Maps items to sketch hashes.
 *
 * <p>The 64-bit seed is folded into the 32-bit seed of {@link Hashing#murmur3_128(int)}. The
 * sketch hash is the first 64 bits of the murmur hash shifted right by one, so it is never
 * negative; 0 is reserved as the "discard" sentinel and as the empty-slot marker in tables.
 */
public final class SketchHashing
{
  private static final HashFunction SEED_HASH_FUNCTION = Hashing.murmur3_128(0);

  private SketchHashing()
  {
  }

  public static HashFunction hashFunction(long seed)
  {
    return Hashing.murmur3_128((int) (seed ^ (seed >>> 32)));
  }

  public static long toSketchHash(HashCode hashCode)
  {
    return hashCode.asLong() >>> 1;
  }

  /**
   * Computes the 16-bit fingerprint used to check that two sketches were built with the same
   * seed, without revealing the seed.
   *
   * @throws SketchContractException if the seed fingerprints to 0
   */
  public static short computeSeedHash(long seed)
  {
    final short seedHash = (short) SEED_HASH_FUNCTION.hashLong(seed).asLong();
    SketchContractException.checkContract(
        seedHash != 0,
        "seed %s produces a zero seed hash, use another seed",
        seed
    );
    return seedHash;
  }

  public static void checkSeedHashes(short expected, short actual)
  {
    SketchContractException.checkContract(
        expected == actual,
        "incompatible seed hashes: expected %s, actual %s",
        Short.toUnsignedInt(expected),
        Short.toUnsignedInt(actual)
    );
  }
}
