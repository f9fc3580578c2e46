package org.minnen.forecastblend;

/** A predicted matrix has no label columns. */
public class EmptyPredictionException extends BlendException
{
  private static final long serialVersionUID = 1L;

  public EmptyPredictionException(String format, Object... args)
  {
    super(format, args);
  }
}
