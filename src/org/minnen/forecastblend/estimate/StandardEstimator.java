package org.minnen.forecastblend.estimate;

import java.util.LinkedHashMap;
import java.util.List;

import org.minnen.forecastblend.align.AlignedData;
import org.minnen.forecastblend.align.Aligner;
import org.minnen.forecastblend.data.FeatureBundle;
import org.minnen.forecastblend.data.FeatureVec;
import org.minnen.forecastblend.data.WeightSet;
import org.minnen.forecastblend.extract.FeatureMap;
import org.minnen.forecastblend.ml.distance.EuclideanReducer;
import org.minnen.forecastblend.ml.distance.Reducer;

/** Weighted sum of sources, with weights derived from how closely each source matched the ground truth. */
public class StandardEstimator implements Estimator
{
  protected final FeatureBundle data;
  protected final FeatureBundle truth;
  protected WeightSet           weights;

  /**
   * @param data predicted values used for learning
   * @param truth ground truth on the same label axis (may be null if weights are supplied instead of learned)
   */
  public StandardEstimator(FeatureBundle data, FeatureBundle truth)
  {
    this.data = data;
    this.truth = truth;
    this.weights = new WeightSet(data.getSources(), new LinkedHashMap<String, FeatureVec>());
  }

  /** Align the data with the given aligner and build an estimator over the result. */
  public static StandardEstimator fromAligner(Aligner aligner, FeatureMap featureMap)
  {
    AlignedData aligned = aligner.align(featureMap);
    return new StandardEstimator(aligned.predicted, aligned.truth);
  }

  public WeightSet reduce()
  {
    return reduce(new EuclideanReducer());
  }

  @Override
  public WeightSet reduce(Reducer reducer)
  {
    if (truth == null) {
      throw new IllegalStateException("Cannot learn weights without ground truth");
    }
    weights = Estimators.learn(data, truth, reducer);
    return weights;
  }

  @Override
  public FeatureBundle produce(FeatureBundle data)
  {
    return Estimators.combine(weights, data);
  }

  @Override
  public WeightSet getWeights()
  {
    return weights;
  }

  /** Replace the current weights, e.g. with weights read from storage. */
  public void setWeights(WeightSet weights)
  {
    this.weights = weights;
  }

  @Override
  public List<String> getSources()
  {
    return data.getSources();
  }

  @Override
  public String toString()
  {
    return String.format("[StandardEstimator: %s %s]", data, weights);
  }
}
