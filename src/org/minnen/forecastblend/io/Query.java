package org.minnen.forecastblend.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Selects the records of one (city, country, forecast distance) slot, newest label first. */
public class Query
{
  public final String       city;
  public final String       country;
  public final int          forecastDistance;

  /** Only records with one of these labels are selected (null = any label). */
  public final List<String> labels;

  /** Maximum number of records to return (zero or less = no limit). */
  public final int          limit;

  public Query(String city, String country, int forecastDistance, int limit)
  {
    this(city, country, forecastDistance, null, limit);
  }

  public Query(String city, String country, int forecastDistance, List<String> labels, int limit)
  {
    this.city = city;
    this.country = country;
    this.forecastDistance = forecastDistance;
    this.labels = labels == null ? null : Collections.unmodifiableList(new ArrayList<>(labels));
    this.limit = limit;
  }

  public Query withLabels(List<String> labels)
  {
    return new Query(city, country, forecastDistance, labels, limit);
  }

  public Query withLimit(int limit)
  {
    return new Query(city, country, forecastDistance, labels, limit);
  }

  public Query withForecastDistance(int forecastDistance)
  {
    return new Query(city, country, forecastDistance, labels, limit);
  }

  public boolean hasLimit()
  {
    return limit > 0;
  }

  @Override
  public String toString()
  {
    return String.format("%s, %s:%d", city, country, forecastDistance);
  }
}
