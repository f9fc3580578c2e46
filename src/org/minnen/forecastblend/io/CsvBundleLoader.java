package org.minnen.forecastblend.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.minnen.forecastblend.HeterogeneousDataException;
import org.minnen.forecastblend.align.AlignedData;
import org.minnen.forecastblend.data.FeatureBundle;
import org.minnen.forecastblend.data.MatrixBuilder;

/**
 * Loads a single feature from a semicolon-separated file.
 * 
 * The header names the columns: label, one column per predicting source, and the ground truth last. Empty or
 * non-numeric cells are treated as missing. Every row must have as many cells as the header.
 */
public class CsvBundleLoader
{
  public static final String DEFAULT_FEATURE = "temperature";

  public static AlignedData load(File file) throws IOException
  {
    return load(file, DEFAULT_FEATURE);
  }

  public static AlignedData load(File file, String feature) throws IOException
  {
    if (!file.canRead()) {
      throw new IOException(String.format("Can't read CSV file (%s)", file.getPath()));
    }
    System.out.printf("Loading CSV data file: [%s]\n", file.getPath());

    String[] header = null;
    List<String> labels = new ArrayList<>();
    List<List<Double>> columns = new ArrayList<>();
    try (BufferedReader in = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      String line;
      while ((line = in.readLine()) != null) {
        line = line.trim();
        if (line.isEmpty()) continue;
        String[] toks = line.split(";", -1);
        if (header == null) {
          if (toks.length < 3) {
            throw new IOException(String.format("CSV header needs a label, a source and a truth column: [%s]", line));
          }
          header = toks;
          for (int k = 1; k < header.length; ++k) {
            columns.add(new ArrayList<>());
          }
          continue;
        }
        if (toks.length != header.length) {
          throw new HeterogeneousDataException("Row '%s' has %d cells but the header has %d columns", toks[0].trim(),
              toks.length, header.length);
        }
        labels.add(toks[0].trim());
        for (int k = 1; k < toks.length; ++k) {
          columns.get(k - 1).add(NumberUtils.toDouble(toks[k].trim(), Double.NaN));
        }
      }
    }
    if (header == null) {
      throw new IOException(String.format("CSV file is empty (%s)", file.getPath()));
    }

    List<String> sources = new ArrayList<>();
    MatrixBuilder builder = new MatrixBuilder(feature);
    for (int k = 1; k < header.length - 1; ++k) {
      String source = header[k].trim();
      sources.add(source);
      builder.addRow(source, toArray(columns.get(k - 1)));
    }
    Map<String, double[][]> predicted = new LinkedHashMap<>();
    predicted.put(feature, builder.build());

    Map<String, double[][]> real = new LinkedHashMap<>();
    real.put(feature, new double[][] { toArray(columns.get(columns.size() - 1)) });
    String truthName = header[header.length - 1].trim();

    return new AlignedData(new FeatureBundle(predicted, sources, labels),
        new FeatureBundle(real, Collections.singletonList(truthName), labels));
  }

  private static double[] toArray(List<Double> values)
  {
    return ArrayUtils.toPrimitive(values.toArray(new Double[0]));
  }
}
