package org.minnen.forecastblend.align;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONObject;
import org.minnen.forecastblend.PathNotFoundException;
import org.minnen.forecastblend.data.FeatureBundle;
import org.minnen.forecastblend.data.MatrixBuilder;
import org.minnen.forecastblend.extract.FeatureMap;

/**
 * Builds aligned (source x label) matrices from per-source record streams.
 * 
 * Each stream is consumed exactly once; a second call to {@link #align} fails and callers must build a new aligner
 * over fresh streams. Records whose label is not on the label axis are skipped; labels a source never reports stay
 * missing (NaN) unless a subclass fills them in.
 */
public abstract class StreamAligner implements Aligner
{
  protected final List<String>                     labels;
  protected final String                           labelKey;
  private final Map<String, Iterable<JSONObject>> sources = new LinkedHashMap<>();
  private final String                             truthName;
  private final Iterable<JSONObject>               truth;
  private AlignedData                              aligned;

  /**
   * @param labels label axis in the order columns should appear
   * @param labelKey record field holding the label
   * @param sources record stream for each predicting source, in declared order
   * @param truthName name of the ground-truth source (ignored if truth is null)
   * @param truth ground-truth record stream, or null
   */
  protected StreamAligner(List<String> labels, String labelKey, Map<String, ? extends Iterable<JSONObject>> sources,
      String truthName, Iterable<JSONObject> truth)
  {
    List<String> axis = new ArrayList<>();
    for (String label : labels) {
      if (!axis.contains(label)) axis.add(label);
    }
    this.labels = Collections.unmodifiableList(axis);
    this.labelKey = labelKey;
    this.sources.putAll(sources);
    this.truthName = truthName;
    this.truth = truth;
  }

  @Override
  public List<String> getLabels()
  {
    return labels;
  }

  @Override
  public List<String> getSourceNames()
  {
    return new ArrayList<>(sources.keySet());
  }

  /** @return predicted and ground-truth bundles from the last call to {@link #align}, or null */
  public AlignedData get()
  {
    return aligned;
  }

  @Override
  public AlignedData align(FeatureMap featureMap)
  {
    if (aligned != null) {
      throw new IllegalStateException("Record streams were already consumed; build a new aligner to align again");
    }
    Map<String, Integer> index = new LinkedHashMap<>();
    for (int i = 0; i < labels.size(); ++i) {
      index.put(labels.get(i), i);
    }

    Map<String, MatrixBuilder> builders = new LinkedHashMap<>();
    for (String feature : featureMap.getFeatures()) {
      builders.put(feature, new MatrixBuilder(feature));
    }
    for (Map.Entry<String, Iterable<JSONObject>> entry : sources.entrySet()) {
      Map<String, double[]> rows = extractRows(featureMap, index, entry.getValue());
      for (String feature : featureMap.getFeatures()) {
        builders.get(feature).addRow(entry.getKey(), rows.get(feature));
      }
    }

    Map<String, double[][]> matrices = new LinkedHashMap<>();
    for (String feature : featureMap.getFeatures()) {
      double[][] m = builders.get(feature).build();
      postProcess(feature, m);
      matrices.put(feature, m);
    }
    FeatureBundle predicted = new FeatureBundle(matrices, getSourceNames(), labels);

    FeatureBundle real = null;
    if (truth != null) {
      Map<String, double[]> rows = extractRows(featureMap, index, truth);
      Map<String, double[][]> realMatrices = new LinkedHashMap<>();
      for (String feature : featureMap.getFeatures()) {
        realMatrices.put(feature, new double[][] { rows.get(feature) });
      }
      real = new FeatureBundle(realMatrices, Collections.singletonList(truthName), labels);
    }

    aligned = new AlignedData(predicted, real);
    return aligned;
  }

  /** Hook for adjusting a freshly stacked (source x label) matrix in place. */
  protected void postProcess(String feature, double[][] m)
  {}

  private Map<String, double[]> extractRows(FeatureMap featureMap, Map<String, Integer> index,
      Iterable<JSONObject> records)
  {
    Map<String, double[]> rows = new LinkedHashMap<>();
    for (String feature : featureMap.getFeatures()) {
      double[] row = new double[labels.size()];
      Arrays.fill(row, Double.NaN);
      rows.put(feature, row);
    }
    for (JSONObject record : records) {
      if (!record.has(labelKey)) {
        throw new PathNotFoundException("Record has no label field '%s'", labelKey);
      }
      Integer j = index.get(String.valueOf(record.get(labelKey)));
      if (j == null) continue;
      for (String feature : featureMap.getFeatures()) {
        rows.get(feature)[j] = featureMap.retrieve(feature, record);
      }
    }
    return rows;
  }
}
