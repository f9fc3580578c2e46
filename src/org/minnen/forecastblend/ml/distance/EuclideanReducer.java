package org.minnen.forecastblend.ml.distance;

import org.minnen.forecastblend.data.FeatureVec;

/** Sum of squared differences: sum((d - y)^2). */
public class EuclideanReducer implements Reducer
{
  @Override
  public double distance(FeatureVec predicted, FeatureVec reference)
  {
    checkDims(predicted, reference);
    return predicted.sub(reference)._sqr().sum();
  }

  static void checkDims(FeatureVec predicted, FeatureVec reference)
  {
    if (predicted.getNumDims() != reference.getNumDims()) {
      throw new IllegalArgumentException(String.format("Vector sizes differ: predicted=%d  reference=%d",
          predicted.getNumDims(), reference.getNumDims()));
    }
  }

  @Override
  public String toString()
  {
    return "euclidean";
  }
}
