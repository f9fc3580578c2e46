package org.minnen.forecastblend.extract;

/** Maps a value extracted from a record to a new value. Transforms are chained left to right. */
public interface Transform
{
  public Object apply(Object value);
}
