package org.minnen.forecastblend.io;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.minnen.forecastblend.data.FeatureBundle;
import org.minnen.forecastblend.estimate.Estimator;

/** Stores learned weights, produced forecasts and cross-validation errors. */
public interface BlendWriter
{
  /** Set the slot description (city, country, forecast distance) attached to everything written next. */
  public void supplement(Map<String, Object> info);

  /** @return current slot description */
  public Map<String, Object> supplement();

  public void writeWeights(Estimator estimator) throws IOException;

  /**
   * Write one error document per label.
   * 
   * @param errors per-source errors (one column) for each feature
   * @param labels labels the errors were measured over
   */
  public void writeErrors(FeatureBundle errors, List<String> labels) throws IOException;

  /** Write one document per label holding the produced value of each feature. */
  public void writeProduced(FeatureBundle produced) throws IOException;
}
