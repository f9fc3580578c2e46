package org.minnen.forecastblend.ml.distance;

import org.minnen.forecastblend.data.FeatureVec;

/** Computes a non-negative distance between a predicted vector and a reference vector. */
public interface Reducer
{
  public double distance(FeatureVec predicted, FeatureVec reference);
}
