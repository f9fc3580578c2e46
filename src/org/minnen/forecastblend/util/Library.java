package org.minnen.forecastblend.util;

import java.util.Arrays;

public final class Library
{
  private Library()
  {}

  public static double sum(double[] a)
  {
    return sum(a, 0, a.length - 1);
  }

  public static double sum(double[] a, int iStart, int iEnd)
  {
    if (iStart < 0) {
      iStart += a.length;
    }
    if (iEnd < 0) {
      iEnd += a.length;
    }
    double sum = 0;
    for (int i = iStart; i <= iEnd; ++i) {
      sum += a[i];
    }
    return sum;
  }

  /** @return index of the largest value (first one on ties), or -1 for an empty array */
  public static int argmax(double[] a)
  {
    if (a.length == 0) return -1;
    int iMax = 0;
    for (int i = 1; i < a.length; ++i) {
      if (a[i] > a[iMax]) {
        iMax = i;
      }
    }
    return iMax;
  }

  /**
   * Scale the values so that they sum to one.
   * 
   * If the sum is exactly zero, all mass goes to the first element: [1, 0, 0, ...].
   * 
   * @return new array holding the normalized values
   */
  public static double[] normalize(double[] a)
  {
    double[] ret = new double[a.length];
    if (a.length == 0) return ret;
    double s = sum(a);
    if (s == 0.0) {
      ret[0] = 1.0;
      return ret;
    }
    for (int i = 0; i < a.length; ++i) {
      ret[i] = a[i] / s;
    }
    return ret;
  }

  /**
   * Turn error magnitudes into weights: normalize(1 - normalize(a)).
   * 
   * Larger values receive smaller weights and the result always sums to one. If every value is zero the first element
   * receives all of the weight.
   */
  public static double[] reverseNormalize(double[] a)
  {
    double[] n = normalize(a);
    if (sum(a) == 0.0) return n;
    for (int i = 0; i < n.length; ++i) {
      n[i] = 1.0 - n[i];
    }
    return normalize(n);
  }

  /** @return true if the value should be treated as a missing observation */
  public static boolean isMissing(double x)
  {
    return Double.isNaN(x);
  }

  /** Replace missing (NaN) cells with zero, in place. */
  public static double[][] missingToZero(double[][] m)
  {
    for (double[] row : m) {
      for (int j = 0; j < row.length; ++j) {
        if (isMissing(row[j])) {
          row[j] = 0.0;
        }
      }
    }
    return m;
  }

  /** @return deep copy of the given matrix */
  public static double[][] copy(double[][] m)
  {
    double[][] ret = new double[m.length][];
    for (int i = 0; i < m.length; ++i) {
      ret[i] = Arrays.copyOf(m[i], m[i].length);
    }
    return ret;
  }

  /** @return number of columns in the matrix (zero if there are no rows) */
  public static int numCols(double[][] m)
  {
    return m.length == 0 ? 0 : m[0].length;
  }
}
