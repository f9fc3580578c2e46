package org.minnen.forecastblend.data;

import java.util.ArrayList;
import java.util.List;

import org.minnen.forecastblend.HeterogeneousDataException;

/** Stacks per-source rows into a matrix, rejecting rows whose length disagrees with the rows already added. */
public class MatrixBuilder
{
  private final String         feature;
  private final List<double[]> rows    = new ArrayList<>();
  private final List<String>   sources = new ArrayList<>();

  public MatrixBuilder(String feature)
  {
    this.feature = feature;
  }

  public MatrixBuilder addRow(String source, double[] row)
  {
    if (!rows.isEmpty() && rows.get(0).length != row.length) {
      throw new HeterogeneousDataException(
          "The row of length %d for source '%s' cannot be stacked under rows of length %d for '%s' (sources %s); "
              + "check that the data is homogeneous",
          row.length, source, rows.get(0).length, feature, sources);
    }
    rows.add(row.clone());
    sources.add(source);
    return this;
  }

  public int getNumRows()
  {
    return rows.size();
  }

  public double[][] build()
  {
    return rows.toArray(new double[rows.size()][]);
  }
}
