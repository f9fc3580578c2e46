package org.minnen.forecastblend.ml.distance;

import org.apache.commons.math3.util.FastMath;
import org.minnen.forecastblend.ConfigurationException;
import org.minnen.forecastblend.data.FeatureVec;

/** Minkowski distance: (sum |d - y|^p)^(1/p). p=1 gives the L1 norm. */
public class MinkowskiReducer implements Reducer
{
  private final double p;

  public MinkowskiReducer()
  {
    this(1.0);
  }

  public MinkowskiReducer(double p)
  {
    if (!(p > 0.0) || Double.isInfinite(p)) {
      throw new ConfigurationException("Minkowski power must be positive and finite (p=%f)", p);
    }
    this.p = p;
  }

  public double getPower()
  {
    return p;
  }

  @Override
  public double distance(FeatureVec predicted, FeatureVec reference)
  {
    EuclideanReducer.checkDims(predicted, reference);
    FeatureVec diff = predicted.sub(reference)._abs();
    if (p == 1.0) return diff.sum();
    return FastMath.pow(diff._pow(p).sum(), 1.0 / p);
  }

  @Override
  public String toString()
  {
    return String.format("minkowski:%s", p == Math.rint(p) ? String.valueOf((long) p) : String.valueOf(p));
  }
}
