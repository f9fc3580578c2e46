package org.minnen.forecastblend.post;

import org.minnen.forecastblend.data.FeatureVec;

/** Rewrites a vector of learned weights or produced values. */
public interface PostProcessor
{
  public FeatureVec apply(FeatureVec value);
}
