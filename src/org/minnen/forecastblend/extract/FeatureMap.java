package org.minnen.forecastblend.extract;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.math.NumberUtils;
import org.json.JSONObject;
import org.minnen.forecastblend.ConfigurationException;

/**
 * Describes how each feature is pulled out of a record: a value path followed by a (possibly empty) chain of
 * transforms.
 */
public class FeatureMap
{
  /** Extraction rule for a single feature. */
  public static class Entry
  {
    public final ValuePath       path;
    public final List<Transform> transforms;

    public Entry(ValuePath path, List<Transform> transforms)
    {
      this.path = path;
      this.transforms = Collections.unmodifiableList(new ArrayList<>(transforms));
    }
  }

  private final Map<String, Entry> entries = new LinkedHashMap<>();

  /** Add a feature read from the given path with the given transforms (applied in order). */
  public FeatureMap add(String feature, ValuePath path, Transform... transforms)
  {
    if (feature == null || feature.isEmpty()) {
      throw new ConfigurationException("Feature name must be non-empty");
    }
    if (path == null) {
      throw new ConfigurationException("Feature '%s' has no value path", feature);
    }
    for (Transform t : transforms) {
      if (t == null) {
        throw new ConfigurationException("Feature '%s' has a null transform", feature);
      }
    }
    entries.put(feature, new Entry(path, Arrays.asList(transforms)));
    return this;
  }

  public FeatureMap add(String feature, String dottedPath, Transform... transforms)
  {
    return add(feature, ValuePath.parse(dottedPath), transforms);
  }

  public Set<String> getFeatures()
  {
    return Collections.unmodifiableSet(entries.keySet());
  }

  public Entry get(String feature)
  {
    return entries.get(feature);
  }

  public int size()
  {
    return entries.size();
  }

  /**
   * Extract the value of a feature from a record.
   * 
   * @return value after all transforms, NaN if the value is null or not numeric
   */
  public double retrieve(String feature, JSONObject record)
  {
    Entry entry = entries.get(feature);
    if (entry == null) {
      throw new ConfigurationException("Unknown feature '%s'; known features are %s", feature, entries.keySet());
    }
    Object value = entry.path.navigate(record);
    for (Transform t : entry.transforms) {
      value = t.apply(value);
    }
    return toDouble(value);
  }

  static double toDouble(Object value)
  {
    if (value == null || JSONObject.NULL.equals(value)) return Double.NaN;
    if (value instanceof Number) return ((Number) value).doubleValue();
    if (value instanceof Boolean) return ((Boolean) value) ? 1.0 : 0.0;
    return NumberUtils.toDouble(value.toString().trim(), Double.NaN);
  }
}
