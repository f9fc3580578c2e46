package org.minnen.forecastblend.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.minnen.forecastblend.ShapeMismatchException;

/** Learned per-feature source weights. Each weight vector has one entry per source. */
public class WeightSet
{
  private final List<String>            sources;
  private final Map<String, FeatureVec> weights;

  public WeightSet(List<String> sources, Map<String, FeatureVec> weights)
  {
    this.sources = Collections.unmodifiableList(new ArrayList<>(sources));
    this.weights = new LinkedHashMap<>();
    for (Map.Entry<String, FeatureVec> entry : weights.entrySet()) {
      FeatureVec w = entry.getValue();
      if (w.getNumDims() != this.sources.size()) {
        throw new ShapeMismatchException("Weights for '%s' have %d entries but there are %d sources %s",
            entry.getKey(), w.getNumDims(), this.sources.size(), this.sources);
      }
      this.weights.put(entry.getKey(), w.dup().setName(entry.getKey()));
    }
  }

  public List<String> getSources()
  {
    return sources;
  }

  public Set<String> getFeatures()
  {
    return Collections.unmodifiableSet(weights.keySet());
  }

  /** @return copy of the weights for the given feature, or null if none were learned */
  public FeatureVec get(String feature)
  {
    FeatureVec w = weights.get(feature);
    return w == null ? null : w.dup();
  }

  public boolean isEmpty()
  {
    return weights.isEmpty();
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder("[Weights: ").append(sources);
    for (Map.Entry<String, FeatureVec> entry : weights.entrySet()) {
      sb.append(String.format(" %s=%s", entry.getKey(), entry.getValue()));
    }
    return sb.append("]").toString();
  }
}
