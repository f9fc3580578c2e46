package org.minnen.forecastblend;

/** No learned weights are available for the requested slot. */
public class MissingWeightsException extends BlendException
{
  private static final long serialVersionUID = 1L;

  public MissingWeightsException(String format, Object... args)
  {
    super(format, args);
  }
}
