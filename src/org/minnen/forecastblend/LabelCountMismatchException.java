package org.minnen.forecastblend;

/** A matrix does not have one column per label. */
public class LabelCountMismatchException extends BlendException
{
  private static final long serialVersionUID = 1L;

  public LabelCountMismatchException(String format, Object... args)
  {
    super(format, args);
  }
}
