package org.minnen.forecastblend.tests;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONObject;
import org.minnen.forecastblend.data.FeatureBundle;

/** Builders for records and bundles shared by the tests. */
public class Fixtures
{
  public static final String CITY    = "Kalush";
  public static final String COUNTRY = "Ukraine";

  public static final Map<String, Object> CHECK_WORDS = new LinkedHashMap<>();
  static
  {
    CHECK_WORDS.put("sun", 1);
    CHECK_WORDS.put("cloud", 2);
    CHECK_WORDS.put("rain", 3);
    CHECK_WORDS.put("shower", 4);
    CHECK_WORDS.put("thunderstorm", 5);
    CHECK_WORDS.put("fog", 6);
    CHECK_WORDS.put("snow", 7);
  }

  public static JSONObject record(String date, int distance, double tmax, double tmin, String description)
  {
    JSONObject temperature = new JSONObject();
    temperature.put("max", tmax);
    temperature.put("min", tmin);
    JSONObject record = new JSONObject();
    record.put("weather_date", date);
    record.put("city", CITY);
    record.put("country", COUNTRY);
    record.put("forecast_distance", distance);
    record.put("temperature", temperature);
    record.put("description", description);
    return record;
  }

  public static JSONObject record(String date, double tmax)
  {
    return record(date, 0, tmax, tmax - 10, "rain");
  }

  /** @return single-feature bundle named "t" with the given rows */
  public static FeatureBundle bundle(List<String> labels, double[]... rows)
  {
    String[] sources = new String[rows.length];
    for (int i = 0; i < rows.length; ++i) {
      sources[i] = "s" + (i + 1);
    }
    return bundle(Arrays.asList(sources), labels, rows);
  }

  public static FeatureBundle bundle(List<String> sources, List<String> labels, double[]... rows)
  {
    Map<String, double[][]> matrices = new LinkedHashMap<>();
    matrices.put("t", rows);
    return new FeatureBundle(matrices, sources, labels);
  }

  public static List<String> labels(String... labels)
  {
    return Arrays.asList(labels);
  }
}
