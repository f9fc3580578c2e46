package org.minnen.forecastblend.io;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.minnen.forecastblend.data.FeatureBundle;
import org.minnen.forecastblend.data.FeatureVec;
import org.minnen.forecastblend.data.WeightSet;
import org.minnen.forecastblend.estimate.Estimator;

/**
 * Stores weights, errors and produced forecasts as JSON arrays in a directory ("weights.json", "errors.json",
 * "produced_data.json").
 * 
 * Documents are upserted: a weight document replaces the one with the same slot and update day; error and produced
 * documents replace the one with the same slot and label. Missing values are written as null.
 */
public class JsonStore implements WeightReader, BlendWriter
{
  public static final String  WEIGHTS           = "weights";
  public static final String  ERRORS            = "errors";
  public static final String  PRODUCED          = "produced_data";

  public static final String  CITY              = "city";
  public static final String  COUNTRY           = "country";
  public static final String  FORECAST_DISTANCE = "forecast_distance";
  public static final String  UPDATED           = "updated";
  public static final String  SLOTS             = "slots";
  public static final String  LABEL             = "label";
  public static final String  DATA              = "data";

  private final File          dir;
  private final Clock         clock;

  private String              city;
  private String              country;
  private Integer             forecastDistance;

  private Map<String, Object> supplementInfo    = new LinkedHashMap<>();

  public JsonStore(File dir)
  {
    this(dir, Clock.systemUTC());
  }

  public JsonStore(File dir, Clock clock)
  {
    this.dir = dir;
    this.clock = clock;
  }

  public static Map<String, Object> slot(String city, String country, int forecastDistance)
  {
    Map<String, Object> slot = new LinkedHashMap<>();
    slot.put(CITY, city);
    slot.put(COUNTRY, country);
    slot.put(FORECAST_DISTANCE, forecastDistance);
    return slot;
  }

  // -- WeightReader ---------------------------------------------------------

  @Override
  public void search(String city, String country, int forecastDistance)
  {
    this.city = city;
    this.country = country;
    this.forecastDistance = forecastDistance;
  }

  @Override
  public Map<String, Object> slot()
  {
    if (forecastDistance == null) return Collections.emptyMap();
    return slot(city, country, forecastDistance);
  }

  @Override
  public WeightSet readWeights()
  {
    if (city == null || country == null || forecastDistance == null) {
      throw new IllegalStateException("No slot selected; call search(...) before readWeights()");
    }
    JSONArray docs;
    try {
      docs = load(WEIGHTS);
    } catch (IOException e) {
      throw new IllegalStateException(String.format("Can't read weights from %s", dir.getPath()), e);
    }
    JSONObject latest = null;
    for (int i = 0; i < docs.length(); ++i) {
      JSONObject doc = docs.getJSONObject(i);
      if (!matches(doc, slot())) continue;
      if (latest == null || doc.optString(UPDATED).compareTo(latest.optString(UPDATED)) > 0) {
        latest = doc;
      }
    }
    return latest == null ? null : toWeights(latest);
  }

  // -- BlendWriter ----------------------------------------------------------

  @Override
  public void supplement(Map<String, Object> info)
  {
    supplementInfo = info == null ? new LinkedHashMap<>() : new LinkedHashMap<>(info);
  }

  @Override
  public Map<String, Object> supplement()
  {
    return Collections.unmodifiableMap(supplementInfo);
  }

  @Override
  public void writeWeights(Estimator estimator) throws IOException
  {
    WeightSet weights = estimator.getWeights();
    JSONObject w = new JSONObject();
    for (String feature : weights.getFeatures()) {
      w.put(feature, toJson(weights.get(feature).get()));
    }
    JSONObject doc = newDocument();
    doc.put(SLOTS, new JSONArray(estimator.getSources()));
    doc.put(WEIGHTS, w);

    Map<String, Object> filter = new LinkedHashMap<>(supplementInfo);
    filter.put(UPDATED, doc.get(UPDATED));
    upsert(WEIGHTS, filter, doc);
  }

  @Override
  public void writeErrors(FeatureBundle errors, List<String> labels) throws IOException
  {
    JSONObject data = new JSONObject();
    for (String feature : errors.getFeatures()) {
      double[] e = new double[errors.getNumSources()];
      for (int i = 0; i < e.length; ++i) {
        e[i] = errors.get(feature, i, 0);
      }
      data.put(feature, toJson(e));
    }
    for (String label : labels) {
      JSONObject doc = newDocument();
      doc.put(DATA, data);
      doc.put(LABEL, label);
      doc.put(SLOTS, new JSONArray(errors.getSources()));
      upsert(ERRORS, labelFilter(label), doc);
    }
  }

  @Override
  public void writeProduced(FeatureBundle produced) throws IOException
  {
    List<String> labels = produced.getLabels();
    for (int j = 0; j < labels.size(); ++j) {
      JSONObject data = new JSONObject();
      for (String feature : produced.getFeatures()) {
        data.put(feature, toJson(produced.get(feature, 0, j)));
      }
      JSONObject doc = newDocument();
      doc.put(DATA, data);
      doc.put(LABEL, labels.get(j));
      doc.put(SLOTS, new JSONArray(produced.getSources()));
      upsert(PRODUCED, labelFilter(labels.get(j)), doc);
    }
  }

  /** @return every document stored in the given collection (empty if the file does not exist) */
  public JSONArray load(String collection) throws IOException
  {
    File file = file(collection);
    if (!file.exists()) return new JSONArray();
    try {
      return new JSONArray(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
    } catch (JSONException e) {
      throw new IOException(String.format("Bad JSON in %s: %s", file.getPath(), e.getMessage()), e);
    }
  }

  private File file(String collection)
  {
    return new File(dir, collection + ".json");
  }

  private JSONObject newDocument()
  {
    JSONObject doc = new JSONObject();
    for (Map.Entry<String, Object> entry : supplementInfo.entrySet()) {
      doc.put(entry.getKey(), entry.getValue());
    }
    doc.put(UPDATED, LocalDate.now(clock).toString());
    return doc;
  }

  private Map<String, Object> labelFilter(String label)
  {
    Map<String, Object> filter = new LinkedHashMap<>(supplementInfo);
    filter.put(LABEL, label);
    return filter;
  }

  private void upsert(String collection, Map<String, Object> filter, JSONObject doc) throws IOException
  {
    JSONArray docs = load(collection);
    JSONArray kept = new JSONArray();
    for (int i = 0; i < docs.length(); ++i) {
      JSONObject old = docs.getJSONObject(i);
      if (!matches(old, filter)) kept.put(old);
    }
    kept.put(doc);
    FileUtils.forceMkdir(dir);
    FileUtils.writeStringToFile(file(collection), kept.toString(2), StandardCharsets.UTF_8);
  }

  private static boolean matches(JSONObject doc, Map<String, Object> filter)
  {
    for (Map.Entry<String, Object> entry : filter.entrySet()) {
      if (!doc.has(entry.getKey())) return false;
      if (!String.valueOf(doc.get(entry.getKey())).equals(String.valueOf(entry.getValue()))) return false;
    }
    return true;
  }

  private static WeightSet toWeights(JSONObject doc)
  {
    JSONArray slots = doc.getJSONArray(SLOTS);
    List<String> sources = new ArrayList<>();
    for (int i = 0; i < slots.length(); ++i) {
      sources.add(slots.getString(i));
    }
    JSONObject w = doc.getJSONObject(WEIGHTS);
    Map<String, FeatureVec> weights = new LinkedHashMap<>();
    for (String feature : w.keySet()) {
      JSONArray a = w.getJSONArray(feature);
      double[] v = new double[a.length()];
      for (int i = 0; i < v.length; ++i) {
        v[i] = a.optDouble(i, Double.NaN);
      }
      weights.put(feature, new FeatureVec(v));
    }
    return new WeightSet(sources, weights);
  }

  private static Object toJson(double x)
  {
    return Double.isFinite(x) ? (Object) x : JSONObject.NULL;
  }

  private static JSONArray toJson(double[] a)
  {
    JSONArray ret = new JSONArray();
    for (double x : a) {
      ret.put(toJson(x));
    }
    return ret;
  }
}
