package io.thetafun.sketch;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.primitives.Longs;

import java.nio.ByteBuffer;
import java.util.Random;

/**
 * Generates distinct-looking ids by hashing a counter together with a seed using sha1, which is
 * much faster than {@link java.util.UUID#randomUUID()}. The same seed always gives the same
 * sequence.
 *
 * <p>see http://antirez.com/news/99
 */
public class RandomIdGenerator
{
  @SuppressWarnings("deprecation") // sha1 is only used as a cheap mixer here
  private static final HashFunction SHA1 = Hashing.sha1();

  private final ByteBuffer buffer = ByteBuffer.allocate(16);
  private long counter = 0;

  public RandomIdGenerator()
  {
    this(new Random().nextLong());
  }

  public RandomIdGenerator(long seed)
  {
    buffer.putLong(8, seed);
  }

  /**
   * @return a 20 bytes id with a very low collision rate
   */
  public byte[] generate()
  {
    buffer.putLong(0, counter++);
    return SHA1.hashBytes(buffer.array()).asBytes();
  }

  /**
   * @return the first 8 bytes of the next id
   */
  public long nextLong()
  {
    return Longs.fromByteArray(generate());
  }
}
