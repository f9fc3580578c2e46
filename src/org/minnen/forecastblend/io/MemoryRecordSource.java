package org.minnen.forecastblend.io;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Record source backed by in-memory documents.
 * 
 * Documents carry "city", "country" and "forecast_distance" fields plus the label field. Collections can be loaded
 * from a directory holding one JSON array per source ("gismeteo.json", "actual_weather.json", ...).
 */
public class MemoryRecordSource implements RecordSource
{
  public static final String                  CITY              = "city";
  public static final String                  COUNTRY           = "country";
  public static final String                  FORECAST_DISTANCE = "forecast_distance";

  private final String                        labelKey;
  private final Map<String, List<JSONObject>> collections       = new LinkedHashMap<>();

  public MemoryRecordSource(String labelKey)
  {
    this.labelKey = labelKey;
  }

  /** Load every *.json file in the directory as a collection named after the file. */
  public static MemoryRecordSource load(File dir, String labelKey) throws IOException
  {
    if (!dir.isDirectory()) {
      throw new IOException(String.format("Record directory does not exist (%s)", dir.getPath()));
    }
    MemoryRecordSource source = new MemoryRecordSource(labelKey);
    Collection<File> files = FileUtils.listFiles(dir, new String[] { "json" }, false);
    for (File file : files) {
      System.out.printf("Loading records: [%s]\n", file.getPath());
      String name = FilenameUtils.getBaseName(file.getName());
      try {
        JSONArray array = new JSONArray(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
        for (int i = 0; i < array.length(); ++i) {
          source.add(name, array.getJSONObject(i));
        }
      } catch (JSONException e) {
        throw new IOException(String.format("Bad JSON in %s: %s", file.getPath(), e.getMessage()), e);
      }
    }
    return source;
  }

  public MemoryRecordSource add(String source, JSONObject record)
  {
    collections.computeIfAbsent(source, k -> new ArrayList<>()).add(record);
    return this;
  }

  public Set<String> getSourceNames()
  {
    return collections.keySet();
  }

  @Override
  public String getLabelKey()
  {
    return labelKey;
  }

  @Override
  public List<JSONObject> find(String source, Query query)
  {
    List<JSONObject> ret = new ArrayList<>();
    Set<String> labels = query.labels == null ? null : new HashSet<>(query.labels);
    for (JSONObject record : collections.getOrDefault(source, new ArrayList<>())) {
      if (query.city != null && !query.city.equals(record.optString(CITY, null))) continue;
      if (query.country != null && !query.country.equals(record.optString(COUNTRY, null))) continue;
      if (record.optInt(FORECAST_DISTANCE, 0) != query.forecastDistance) continue;
      if (!record.has(labelKey)) continue;
      if (labels != null && !labels.contains(label(record))) continue;
      ret.add(record);
    }
    ret.sort(Comparator.comparing(this::label).reversed());
    if (query.hasLimit() && ret.size() > query.limit) {
      return new ArrayList<>(ret.subList(0, query.limit));
    }
    return ret;
  }

  @Override
  public int getMaxForecastDistance(String source)
  {
    int max = -1;
    for (JSONObject record : collections.getOrDefault(source, new ArrayList<>())) {
      max = Math.max(max, record.optInt(FORECAST_DISTANCE, 0));
    }
    return max;
  }

  private String label(JSONObject record)
  {
    return String.valueOf(record.get(labelKey));
  }
}
