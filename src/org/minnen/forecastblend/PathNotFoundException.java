package org.minnen.forecastblend;

/** A value path could not be followed through a record. */
public class PathNotFoundException extends BlendException
{
  private static final long serialVersionUID = 1L;

  public PathNotFoundException(String format, Object... args)
  {
    super(format, args);
  }
}
