package org.minnen.forecastblend.align;

import java.util.List;

import org.minnen.forecastblend.extract.FeatureMap;

/** Lays the records of several sources out on a shared label axis. */
public interface Aligner
{
  /** @return label axis in column order */
  public List<String> getLabels();

  /** @return predicting sources in row order */
  public List<String> getSourceNames();

  /** Extract every feature of the map and stack the values into aligned bundles. */
  public AlignedData align(FeatureMap featureMap);
}
