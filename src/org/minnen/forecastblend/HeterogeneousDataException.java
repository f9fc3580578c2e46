package org.minnen.forecastblend;

/** Rows of different lengths were stacked into one matrix. */
public class HeterogeneousDataException extends BlendException
{
  private static final long serialVersionUID = 1L;

  public HeterogeneousDataException(String format, Object... args)
  {
    super(format, args);
  }
}
