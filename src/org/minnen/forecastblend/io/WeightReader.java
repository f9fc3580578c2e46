package org.minnen.forecastblend.io;

import java.util.Map;

import org.minnen.forecastblend.data.WeightSet;

/** Reads previously learned weights for one slot. */
public interface WeightReader
{
  /** Select the slot that {@link #readWeights()} reads. */
  public void search(String city, String country, int forecastDistance);

  /**
   * @return most recently written weights for the selected slot, or null if none exist
   * @throws IllegalStateException if no slot was selected
   */
  public WeightSet readWeights();

  /** @return description of the selected slot (city, country, forecast distance) */
  public Map<String, Object> slot();
}
