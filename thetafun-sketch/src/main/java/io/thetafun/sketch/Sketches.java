package io.thetafun.sketch;

import com.google.common.base.Supplier;

/**
 * Builds update sketches from short names, for the command-line tools.
 *
 * <p>{@code theta} uses the default nominal size, {@code theta12} sets lgK to 12 and
 * {@code theta12x2} additionally sets the resize factor to 2.
 */
public final class Sketches
{
  private static final String THETA = "theta";

  private Sketches()
  {
  }

  public static UpdateThetaSketch get(String name)
  {
    return get(name, ThetaConstants.DEFAULT_SEED);
  }

  public static UpdateThetaSketch get(String name, long seed)
  {
    return builder(name).setSeed(seed).build();
  }

  public static UpdateThetaSketch.Builder builder(String name)
  {
    if (!name.startsWith(THETA)) {
      throw new IllegalArgumentException("Unknown sketch : " + name);
    }
    String suffix = name.substring(THETA.length());
    UpdateThetaSketch.Builder builder = UpdateThetaSketch.builder();
    if (suffix.isEmpty()) {
      return builder;
    }

    int x = suffix.indexOf('x');
    try {
      String lgKStr = x < 0 ? suffix : suffix.substring(0, x);
      if (!lgKStr.isEmpty()) {
        builder.setLgK(Integer.parseInt(lgKStr));
      }
      if (x >= 0) {
        builder.setResizeFactor(Integer.parseInt(suffix.substring(x + 1)));
      }
    }
    catch (NumberFormatException e) {
      throw new IllegalArgumentException("Unknown sketch : " + name, e);
    }
    return builder;
  }

  public static Supplier<UpdateThetaSketch> lazyGet(String name, long seed)
  {
    return () -> get(name, seed);
  }
}
