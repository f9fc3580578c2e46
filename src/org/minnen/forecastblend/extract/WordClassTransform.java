package org.minnen.forecastblend.extract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.json.JSONObject;
import org.minnen.forecastblend.ConfigurationException;

/**
 * Maps a free-text description to a numeric class.
 * 
 * Each noun of the text is compared with every canonical word using the Levenshtein distance; the class of the
 * closest canonical word is returned. Ties go to the pair seen first (nouns in text order, canonical words in
 * insertion order). Text without nouns maps to the smallest class value.
 * 
 * Example class map: sun=1, cloud=2, rain=3, shower=4, thunderstorm=5, fog=6, snow=7.
 */
public class WordClassTransform implements Transform
{
  private final Map<String, Double> classes = new LinkedHashMap<>();
  private final NounTagger          tagger;
  private final double              minClass;

  public WordClassTransform(Map<?, ?> classes)
  {
    this(classes, new SimpleNounTagger());
  }

  public WordClassTransform(Map<?, ?> classes, NounTagger tagger)
  {
    if (classes == null || classes.isEmpty()) {
      throw new ConfigurationException("Class map must contain at least one word");
    }
    if (tagger == null) {
      throw new ConfigurationException("Class transform needs a noun tagger");
    }
    double min = Double.POSITIVE_INFINITY;
    for (Map.Entry<?, ?> entry : classes.entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        throw new ConfigurationException("All class map keys must be text but '%s' is not", entry.getKey());
      }
      if (!(entry.getValue() instanceof Number)) {
        throw new ConfigurationException("All class map values must be numeric but '%s' (for '%s') is not",
            entry.getValue(), entry.getKey());
      }
      double value = ((Number) entry.getValue()).doubleValue();
      this.classes.put(((String) entry.getKey()).toLowerCase(Locale.ROOT), value);
      min = Math.min(min, value);
    }
    this.tagger = tagger;
    this.minClass = min;
  }

  public Map<String, Double> getClasses()
  {
    return Collections.unmodifiableMap(classes);
  }

  @Override
  public Object apply(Object value)
  {
    if (value == null || JSONObject.NULL.equals(value)) {
      return minClass;
    }
    List<String> nouns = tagger.nouns(value.toString().toLowerCase(Locale.ROOT));
    String best = null;
    int bestDist = Integer.MAX_VALUE;
    for (String noun : nouns) {
      for (String word : classes.keySet()) {
        int d = StringUtils.getLevenshteinDistance(word, noun);
        if (d < bestDist) {
          bestDist = d;
          best = word;
        }
      }
    }
    return best == null ? minClass : classes.get(best);
  }
}
