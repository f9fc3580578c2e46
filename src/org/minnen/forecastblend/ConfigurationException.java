package org.minnen.forecastblend;

/** Bad construction-time input such as an empty class map or a missing setting. */
public class ConfigurationException extends BlendException
{
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String format, Object... args)
  {
    super(format, args);
  }
}
