package org.minnen.forecastblend.extract;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tagger that keeps every alphabetic word that is not a common function word or intensity modifier.
 * 
 * Weather descriptions are short noun phrases ("light rain", "partly cloudy, thunderstorm"), so this approximates a
 * part-of-speech tagger well enough for class mapping. Plug in a real tagger through {@link NounTagger} if needed.
 */
public class SimpleNounTagger implements NounTagger
{
  private static final Set<String> STOP_WORDS = new HashSet<>(Arrays.asList("a", "an", "the", "and", "or", "with",
      "without", "of", "in", "on", "at", "to", "for", "by", "from", "is", "are", "be", "it", "no", "not", "very",
      "light", "heavy", "moderate", "partly", "mostly", "possible", "chance", "slight", "strong", "weak", "some",
      "few", "little", "small", "short", "then", "later", "early", "late"));

  @Override
  public List<String> nouns(String text)
  {
    List<String> tokens = new ArrayList<>();
    if (text == null) return tokens;
    for (String tok : text.toLowerCase(Locale.ROOT).split("[^\\p{L}]+")) {
      if (tok.length() < 2 || STOP_WORDS.contains(tok)) continue;
      tokens.add(tok);
    }
    return tokens;
  }
}
