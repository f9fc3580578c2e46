package org.minnen.forecastblend;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.lang3.math.NumberUtils;
import org.minnen.forecastblend.extract.FeatureMap;
import org.minnen.forecastblend.extract.WordClassTransform;
import org.minnen.forecastblend.ml.distance.Reducer;
import org.minnen.forecastblend.ml.distance.Reducers;

/** Settings for a reduce / produce run. */
public class BlendConfig
{
  public static final String              DEFAULT_FILE      = "forecastblend.properties";

  /** Feature name and value path of every numeric weather field. */
  public static final String[][]          DEFAULT_FEATURES  = { { "temperature_max", "temperature.max" },
      { "temperature_min", "temperature.min" }, { "feels_temperature_max", "feels_temperature.max" },
      { "feels_temperature_min", "feels_temperature.min" }, { "pressure_max", "pressure.max" },
      { "pressure_min", "pressure.min" }, { "humidity_max", "humidity.max" }, { "humidity_min", "humidity.min" },
      { "precipitation_max", "precipitation.max" }, { "precipitation_min", "precipitation.min" },
      { "wind_direction_max", "wind_direction.max" }, { "wind_direction_min", "wind_direction.min" },
      { "wind_speed_max", "wind_speed.max" }, { "wind_speed_min", "wind_speed.min" } };

  /** Name of the feature computed from the text description. */
  public static final String              CLASS_FEATURE     = "class";

  public final List<String>               sources;
  public final String                     truth;
  public final String                     city;
  public final String                     country;
  public final int                        limit;
  public final int                        maxDistance;
  public final String                     labelKey;
  public final File                       dataDir;
  public final File                       outputDir;
  public final Reducer                    reducer;
  public final Map<String, String>        features;
  public final String                     classPath;
  public final Map<String, Object>        classes;

  private BlendConfig(Configuration config)
  {
    sources = Collections.unmodifiableList(splitList(required(config, "blend.sources")));
    if (sources.isEmpty()) {
      throw new ConfigurationException("Setting 'blend.sources' lists no sources");
    }
    truth = required(config, "blend.truth");
    city = required(config, "blend.city");
    country = required(config, "blend.country");
    limit = intValue(config, "blend.limit", 30);
    maxDistance = intValue(config, "blend.maxDistance", 0);
    labelKey = config.getString("blend.labelKey", "weather_date");
    dataDir = new File(config.getString("blend.data", "data"));
    outputDir = new File(config.getString("blend.output", "output"));
    reducer = Reducers.parse(config.getString("blend.reducer", "euclidean"));

    Map<String, String> f = new LinkedHashMap<>();
    if (config.containsKey("blend.features")) {
      for (String item : splitList(config.getString("blend.features"))) {
        String[] parts = item.split(":");
        if (parts.length != 2 || parts[0].trim().isEmpty() || parts[1].trim().isEmpty()) {
          throw new ConfigurationException("Feature '%s' must look like name:path", item);
        }
        f.put(parts[0].trim(), parts[1].trim());
      }
    } else {
      for (String[] pair : DEFAULT_FEATURES) {
        f.put(pair[0], pair[1]);
      }
    }
    features = Collections.unmodifiableMap(f);

    classPath = config.getString("blend.classPath", "description");
    Map<String, Object> c = new LinkedHashMap<>();
    Iterator<String> keys = config.getKeys("blend.classes");
    while (keys.hasNext()) {
      String key = keys.next();
      if (!key.startsWith("blend.classes.")) continue;
      String word = key.substring("blend.classes.".length());
      String value = config.getString(key);
      if (!NumberUtils.isCreatable(value)) {
        throw new ConfigurationException("Class value for '%s' is not numeric: '%s'", word, value);
      }
      c.put(word, NumberUtils.createDouble(value));
    }
    classes = Collections.unmodifiableMap(c);
  }

  /** Build settings from the given `config`; required keys are sources, truth, city and country. */
  public static BlendConfig configure(Configuration config)
  {
    return new BlendConfig(config);
  }

  /** Load a properties file. */
  public static Configuration load(File file) throws IOException
  {
    if (!file.canRead()) {
      throw new IOException(String.format("Can't read config file (%s)", file.getPath()));
    }
    PropertiesConfiguration config = new PropertiesConfiguration();
    try (Reader in = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      config.read(in);
    } catch (org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new IOException(String.format("Bad config file (%s): %s", file.getPath(), e.getMessage()), e);
    }
    return config;
  }

  /** @return feature extraction rules: every numeric feature plus the class feature when classes are configured */
  public FeatureMap buildFeatureMap()
  {
    FeatureMap map = new FeatureMap();
    for (Map.Entry<String, String> entry : features.entrySet()) {
      map.add(entry.getKey(), entry.getValue());
    }
    if (!classes.isEmpty()) {
      map.add(CLASS_FEATURE, classPath, new WordClassTransform(classes));
    }
    return map;
  }

  private static String required(Configuration config, String key)
  {
    String value = config.getString(key);
    if (value == null || value.trim().isEmpty()) {
      throw new ConfigurationException("Missing required setting '%s'", key);
    }
    return value.trim();
  }

  private static int intValue(Configuration config, String key, int defaultValue)
  {
    String value = config.getString(key);
    if (value == null) return defaultValue;
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Setting '%s' must be an integer, not '%s'", key, value);
    }
  }

  private static List<String> splitList(String value)
  {
    List<String> ret = new ArrayList<>();
    for (String tok : value.split(",")) {
      if (!tok.trim().isEmpty()) ret.add(tok.trim());
    }
    return ret;
  }
}
