package org.minnen.forecastblend.align;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Chooses the label axis shared by a group of sources. Labels compare as strings (ISO dates sort correctly). */
public final class Labels
{
  private Labels()
  {}

  /**
   * Labels present in the reference and in every source, newest first.
   * 
   * @param reference labels of the ground-truth source
   * @param sources labels of each predicting source
   * @param limit keep at most this many labels (zero or less = all)
   */
  public static List<String> intersect(Collection<String> reference, List<? extends Collection<String>> sources,
      int limit)
  {
    Set<String> common = new LinkedHashSet<>(reference);
    for (Collection<String> labels : sources) {
      common.retainAll(labels);
    }
    List<String> ret = new ArrayList<>(common);
    Collections.sort(ret, Collections.reverseOrder());
    return truncate(ret, limit);
  }

  /**
   * Labels present in any source: deduplicated, sorted ascending and reduced to the last (largest) {@code limit}.
   */
  public static List<String> union(List<? extends Collection<String>> sources, int limit)
  {
    UniqueMinQueue<String> queue = new UniqueMinQueue<>();
    for (Collection<String> labels : sources) {
      for (String label : labels) {
        queue.add(label);
      }
    }
    List<String> ret = queue.drain();
    if (limit > 0 && ret.size() > limit) {
      return new ArrayList<>(ret.subList(ret.size() - limit, ret.size()));
    }
    return ret;
  }

  private static List<String> truncate(List<String> labels, int limit)
  {
    if (limit > 0 && labels.size() > limit) {
      return new ArrayList<>(labels.subList(0, limit));
    }
    return labels;
  }
}
