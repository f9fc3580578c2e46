package org.minnen.forecastblend;

/** Base class for errors raised while aligning, learning or combining forecasts. */
public class BlendException extends RuntimeException
{
  private static final long serialVersionUID = 1L;

  public BlendException(String message)
  {
    super(message);
  }

  public BlendException(String format, Object... args)
  {
    super(String.format(format, args));
  }
}
