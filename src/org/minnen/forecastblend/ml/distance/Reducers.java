package org.minnen.forecastblend.ml.distance;

import java.util.Locale;

import org.minnen.forecastblend.ConfigurationException;

public final class Reducers
{
  private Reducers()
  {}

  /**
   * Build a reducer from its name: "euclidean", "minkowski" (p=1) or "minkowski:p".
   */
  public static Reducer parse(String name)
  {
    String s = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    if (s.isEmpty() || s.equals("euclidean") || s.equals("l2")) {
      return new EuclideanReducer();
    }
    if (s.equals("minkowski") || s.equals("l1")) {
      return new MinkowskiReducer();
    }
    if (s.startsWith("minkowski:")) {
      try {
        return new MinkowskiReducer(Double.parseDouble(s.substring("minkowski:".length())));
      } catch (NumberFormatException e) {
        throw new ConfigurationException("Bad Minkowski power in reducer '%s'", name);
      }
    }
    throw new ConfigurationException("Unknown reducer '%s'", name);
  }
}
