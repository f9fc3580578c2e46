package org.minnen.forecastblend.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.minnen.forecastblend.ShapeMismatchException;
import org.minnen.forecastblend.util.Library;

/**
 * Matrices of per-feature values laid out on a shared (source x label) grid.
 * 
 * Every matrix has one row per source and one column per label. Predicted bundles have a row for each forecast
 * source; ground-truth bundles have a single row. Missing cells hold NaN.
 */
public class FeatureBundle
{
  private final Map<String, double[][]> matrices;
  private final List<String>            sources;
  private final List<String>            labels;

  public FeatureBundle(Map<String, double[][]> matrices, List<String> sources, List<String> labels)
  {
    this.sources = Collections.unmodifiableList(new ArrayList<>(sources));
    this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
    this.matrices = new LinkedHashMap<>();
    for (Map.Entry<String, double[][]> entry : matrices.entrySet()) {
      String feature = entry.getKey();
      double[][] m = entry.getValue();
      if (m.length != this.sources.size()) {
        throw new ShapeMismatchException("Matrix for '%s' has %d rows but there are %d sources %s", feature, m.length,
            this.sources.size(), this.sources);
      }
      for (int i = 0; i < m.length; ++i) {
        if (m[i].length != this.labels.size()) {
          throw new ShapeMismatchException("Matrix for '%s' has %d columns in row '%s' but there are %d labels",
              feature, m[i].length, this.sources.get(i), this.labels.size());
        }
      }
      this.matrices.put(feature, Library.copy(m));
    }
  }

  /** @return names of the features in insertion order */
  public Set<String> getFeatures()
  {
    return Collections.unmodifiableSet(matrices.keySet());
  }

  public boolean hasFeature(String feature)
  {
    return matrices.containsKey(feature);
  }

  public List<String> getSources()
  {
    return sources;
  }

  public List<String> getLabels()
  {
    return labels;
  }

  public int getNumSources()
  {
    return sources.size();
  }

  public int getNumLabels()
  {
    return labels.size();
  }

  /** @return copy of the matrix for the given feature, or null if the feature is unknown */
  public double[][] getMatrix(String feature)
  {
    double[][] m = matrices.get(feature);
    return m == null ? null : Library.copy(m);
  }

  /** @return row of the given feature matrix as a new feature vector named after its source */
  public FeatureVec getRow(String feature, int iSource)
  {
    return new FeatureVec(matrices.get(feature)[iSource]).setName(sources.get(iSource));
  }

  /** @return value of one cell (NaN if missing) */
  public double get(String feature, int iSource, int iLabel)
  {
    return matrices.get(feature)[iSource][iLabel];
  }

  @Override
  public String toString()
  {
    return String.format("[Bundle: %d features, %d sources x %d labels]", matrices.size(), sources.size(),
        labels.size());
  }
}
