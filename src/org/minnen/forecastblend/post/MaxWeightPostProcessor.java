package org.minnen.forecastblend.post;

import org.minnen.forecastblend.data.FeatureVec;

/**
 * Winner-take-all selection: 1 at the position of the largest value (first on ties), 0 elsewhere.
 * 
 * For example, [3, 6, 1] becomes [0, 1, 0].
 */
public class MaxWeightPostProcessor implements PostProcessor
{
  @Override
  public FeatureVec apply(FeatureVec value)
  {
    FeatureVec ret = FeatureVec.zeros(value.getNumDims()).setName(value.getName());
    int iMax = value.argmax();
    if (iMax >= 0) {
      ret.set(iMax, 1.0);
    }
    return ret;
  }
}
