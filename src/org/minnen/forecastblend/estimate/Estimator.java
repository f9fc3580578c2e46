package org.minnen.forecastblend.estimate;

import java.util.List;

import org.minnen.forecastblend.data.FeatureBundle;
import org.minnen.forecastblend.data.WeightSet;
import org.minnen.forecastblend.ml.distance.Reducer;

/**
 * Learns how much to trust each source and combines sources accordingly.
 * 
 * <ul>
 * <li>{@code reduce} learns weights from the distance between each source and the ground truth.
 * <li>{@code produce} applies the learned weights to new data.
 * </ul>
 */
public interface Estimator
{
  public WeightSet reduce(Reducer reducer);

  public FeatureBundle produce(FeatureBundle data);

  /** @return current weights (empty before the first reduce) */
  public WeightSet getWeights();

  public List<String> getSources();
}
