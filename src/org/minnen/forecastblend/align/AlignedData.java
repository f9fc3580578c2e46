package org.minnen.forecastblend.align;

import org.minnen.forecastblend.data.FeatureBundle;

/** Result of an alignment: predicted values of every source and, optionally, the ground truth. */
public class AlignedData
{
  public final FeatureBundle predicted;

  /** Ground-truth values on the same label axis, or null when no reference source was given. */
  public final FeatureBundle truth;

  public AlignedData(FeatureBundle predicted, FeatureBundle truth)
  {
    this.predicted = predicted;
    this.truth = truth;
  }

  public boolean hasTruth()
  {
    return truth != null;
  }
}
