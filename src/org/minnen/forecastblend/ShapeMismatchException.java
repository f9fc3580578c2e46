package org.minnen.forecastblend;

/** Matrix, source and label sizes of a bundle disagree. */
public class ShapeMismatchException extends BlendException
{
  private static final long serialVersionUID = 1L;

  public ShapeMismatchException(String format, Object... args)
  {
    super(format, args);
  }
}
