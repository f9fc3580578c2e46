package org.minnen.forecastblend.estimate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.minnen.forecastblend.align.AlignedData;
import org.minnen.forecastblend.align.Aligner;
import org.minnen.forecastblend.data.FeatureBundle;
import org.minnen.forecastblend.data.FeatureVec;
import org.minnen.forecastblend.data.WeightSet;
import org.minnen.forecastblend.extract.FeatureMap;
import org.minnen.forecastblend.ml.distance.Reducer;
import org.minnen.forecastblend.post.PostProcessor;

/**
 * Standard estimator whose learned weights and produced rows can be rewritten per feature.
 * 
 * For example, mapping "class" to a {@link org.minnen.forecastblend.post.MaxWeightPostProcessor} makes the class
 * forecast come from the single best source instead of a blend.
 */
public class PostProcessEstimator extends StandardEstimator
{
  public PostProcessEstimator(FeatureBundle data, FeatureBundle truth)
  {
    super(data, truth);
  }

  public static PostProcessEstimator fromAligner(Aligner aligner, FeatureMap featureMap)
  {
    AlignedData aligned = aligner.align(featureMap);
    return new PostProcessEstimator(aligned.predicted, aligned.truth);
  }

  /** Learn weights, then run each feature's weights through its post-processors in order. */
  public WeightSet reduce(Reducer reducer, Map<String, List<PostProcessor>> weightPostProcessors)
  {
    WeightSet learned = super.reduce(reducer);
    if (weightPostProcessors == null || weightPostProcessors.isEmpty()) {
      return learned;
    }
    Map<String, FeatureVec> processed = new LinkedHashMap<>();
    for (String feature : learned.getFeatures()) {
      processed.put(feature, apply(learned.get(feature), weightPostProcessors.get(feature)));
    }
    weights = new WeightSet(learned.getSources(), processed);
    return weights;
  }

  /** Combine the data, then run each feature's produced row through its post-processors in order. */
  public FeatureBundle produce(FeatureBundle data, Map<String, List<PostProcessor>> dataPostProcessors)
  {
    FeatureBundle produced = super.produce(data);
    if (dataPostProcessors == null || dataPostProcessors.isEmpty()) {
      return produced;
    }
    Map<String, double[][]> processed = new LinkedHashMap<>();
    for (String feature : produced.getFeatures()) {
      FeatureVec row = apply(produced.getRow(feature, 0), dataPostProcessors.get(feature));
      processed.put(feature, new double[][] { row.toArray() });
    }
    return new FeatureBundle(processed, produced.getSources(), produced.getLabels());
  }

  private static FeatureVec apply(FeatureVec value, List<PostProcessor> processors)
  {
    if (processors == null) return value;
    for (PostProcessor p : processors) {
      value = p.apply(value);
    }
    return value;
  }
}
