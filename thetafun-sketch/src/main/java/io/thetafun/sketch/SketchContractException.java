package io.thetafun.sketch;

import com.google.common.base.Strings;

/**
 * Thrown when a caller breaks the contract of a sketch: an invalid builder configuration, or
 * sketches built with different seeds being combined. The sketch or union is left unchanged.
 */
public class SketchContractException extends IllegalArgumentException
{
  public SketchContractException(String message)
  {
    super(message);
  }

  public static void checkContract(boolean expression, String template, Object... args)
  {
    if (!expression) {
      throw new SketchContractException(Strings.lenientFormat(template, args));
    }
  }
}
