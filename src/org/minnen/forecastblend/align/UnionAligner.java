package org.minnen.forecastblend.align;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONObject;
import org.minnen.forecastblend.io.Query;
import org.minnen.forecastblend.io.RecordSource;
import org.minnen.forecastblend.util.Library;

/**
 * Aligns sources on every label reported by any of them.
 * 
 * A cell missing from one source is filled with the first value found for the same label when scanning the sources
 * from top to bottom in declared order. Labels no source reports stay NaN.
 */
public class UnionAligner extends StreamAligner
{
  public UnionAligner(List<String> labels, String labelKey, Map<String, ? extends Iterable<JSONObject>> sources,
      String truthName, Iterable<JSONObject> truth)
  {
    super(labels, labelKey, sources, truthName, truth);
  }

  public UnionAligner(List<String> labels, String labelKey, Map<String, ? extends Iterable<JSONObject>> sources)
  {
    this(labels, labelKey, sources, null, null);
  }

  /**
   * Query the record source for the union of labels across all predicting sources.
   * 
   * @param truthName ground-truth source; if non-null, candidate labels are restricted to its newest labels and its
   *          records are aligned as well
   */
  public static UnionAligner fromSource(RecordSource source, List<String> sourceNames, String truthName, Query query)
  {
    Query search = query;
    if (truthName != null) {
      search = query.withLabels(source.findLabels(truthName, query));
    }
    List<List<String>> candidates = new ArrayList<>();
    for (String name : sourceNames) {
      candidates.add(source.findLabels(name, search));
    }
    List<String> labels = Labels.union(candidates, query.limit);

    Query selected = query.withLabels(labels);
    List<JSONObject> truth = truthName == null ? null : source.find(truthName, selected);
    Map<String, List<JSONObject>> streams = new LinkedHashMap<>();
    for (String name : sourceNames) {
      streams.put(name, source.find(name, selected.withLimit(0)));
    }
    return new UnionAligner(labels, source.getLabelKey(), streams, truthName, truth);
  }

  @Override
  protected void postProcess(String feature, double[][] m)
  {
    fill(m);
  }

  /** Replace each missing cell with the first available value in its column, scanning rows top to bottom. */
  public static void fill(double[][] m)
  {
    for (int j = 0; j < Library.numCols(m); ++j) {
      double first = Double.NaN;
      for (double[] row : m) {
        if (!Library.isMissing(row[j])) {
          first = row[j];
          break;
        }
      }
      for (double[] row : m) {
        if (Library.isMissing(row[j])) {
          row[j] = first;
        }
      }
    }
  }
}
