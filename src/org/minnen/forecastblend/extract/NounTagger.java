package org.minnen.forecastblend.extract;

import java.util.List;

/** Finds the noun-like tokens of a piece of text. */
public interface NounTagger
{
  /** @return lower-case noun tokens in the order they appear (empty if there are none) */
  public List<String> nouns(String text);
}
