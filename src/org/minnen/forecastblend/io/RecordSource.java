package org.minnen.forecastblend.io;

import java.util.ArrayList;
import java.util.List;

import org.json.JSONObject;

/** Provides forecast and observation records, one named collection per source. */
public interface RecordSource
{
  /** @return name of the record field that holds the label (e.g. "weather_date") */
  public String getLabelKey();

  /** @return matching records of the given source sorted by descending label and truncated to the query limit */
  public List<JSONObject> find(String source, Query query);

  /** @return largest forecast distance stored for the given source (-1 if it has no records) */
  public int getMaxForecastDistance(String source);

  /** @return labels of the records selected by the query, in the order they were returned */
  public default List<String> findLabels(String source, Query query)
  {
    List<String> labels = new ArrayList<>();
    for (JSONObject record : find(source, query)) {
      labels.add(String.valueOf(record.get(getLabelKey())));
    }
    return labels;
  }
}
