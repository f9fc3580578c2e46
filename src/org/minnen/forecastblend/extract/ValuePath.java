package org.minnen.forecastblend.extract;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;
import org.minnen.forecastblend.ConfigurationException;
import org.minnen.forecastblend.PathNotFoundException;

/**
 * Sequence of keys that leads from the root of a record to a single value.
 * 
 * Keys address fields of a JSON object; when the current node is an array the key must be an integer index.
 */
public class ValuePath
{
  private final List<String> keys;

  public ValuePath(String... keys)
  {
    if (keys.length == 0) {
      throw new ConfigurationException("A value path needs at least one key");
    }
    for (String key : keys) {
      if (key == null || key.isEmpty()) {
        throw new ConfigurationException("Empty key in value path %s", Arrays.toString(keys));
      }
    }
    this.keys = Collections.unmodifiableList(Arrays.asList(keys.clone()));
  }

  /** @return path built from a dotted string such as "temperature.max" */
  public static ValuePath parse(String dotted)
  {
    if (dotted == null || dotted.trim().isEmpty()) {
      throw new ConfigurationException("Empty value path");
    }
    return new ValuePath(dotted.trim().split("\\."));
  }

  public List<String> getKeys()
  {
    return keys;
  }

  /**
   * Follow this path through the given record.
   * 
   * @return the value at the end of the path (JSONObject.NULL for an explicit null)
   * @throws PathNotFoundException if any key along the path is absent
   */
  public Object navigate(JSONObject record)
  {
    Object node = record;
    for (int i = 0; i < keys.size(); ++i) {
      String key = keys.get(i);
      if (node instanceof JSONObject) {
        JSONObject obj = (JSONObject) node;
        if (!obj.has(key)) {
          throw new PathNotFoundException("Key '%s' of path %s not found in record", key, this);
        }
        node = obj.get(key);
      } else if (node instanceof JSONArray) {
        JSONArray array = (JSONArray) node;
        int index;
        try {
          index = Integer.parseInt(key);
        } catch (NumberFormatException e) {
          throw new PathNotFoundException("Key '%s' of path %s cannot index an array", key, this);
        }
        if (index < 0 || index >= array.length()) {
          throw new PathNotFoundException("Index %d of path %s is outside an array of length %d", index, this,
              array.length());
        }
        node = array.get(index);
      } else {
        throw new PathNotFoundException("Key '%s' of path %s reached a leaf value", key, this);
      }
    }
    return node;
  }

  @Override
  public String toString()
  {
    return String.join(".", keys);
  }
}
