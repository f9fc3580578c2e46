package org.minnen.forecastblend.align;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONObject;
import org.minnen.forecastblend.io.Query;
import org.minnen.forecastblend.io.RecordSource;

/**
 * Aligns sources on the labels that the ground truth and every source have in common.
 */
public class IntersectAligner extends StreamAligner
{
  public IntersectAligner(List<String> labels, String labelKey, Map<String, ? extends Iterable<JSONObject>> sources,
      String truthName, Iterable<JSONObject> truth)
  {
    super(labels, labelKey, sources, truthName, truth);
  }

  /**
   * Query the record source for the newest labels shared by the truth and all predicting sources, then load the
   * matching records. The query limit applies to the shared labels, not to each source's labels.
   */
  public static IntersectAligner fromSource(RecordSource source, List<String> sourceNames, String truthName,
      Query query)
  {
    Query all = query.withLimit(0);
    List<String> reference = source.findLabels(truthName, all);
    List<List<String>> candidates = new ArrayList<>();
    for (String name : sourceNames) {
      candidates.add(source.findLabels(name, all));
    }
    List<String> labels = Labels.intersect(reference, candidates, query.limit);

    Query selected = query.withLabels(labels);
    List<JSONObject> truth = source.find(truthName, selected);
    Map<String, List<JSONObject>> streams = new LinkedHashMap<>();
    for (String name : sourceNames) {
      streams.put(name, source.find(name, selected.withLimit(0)));
    }
    return new IntersectAligner(labels, source.getLabelKey(), streams, truthName, truth);
  }
}
