package org.minnen.forecastblend.data;

import java.util.Arrays;

import org.apache.commons.math3.util.FastMath;
import org.minnen.forecastblend.util.Library;

/** represents a vector in R^n */
public class FeatureVec
{
  /** actual data */
  private double[] vec;
  private String   name;

  /**
   * Create a feature vec from the double array
   * 
   * @param vec data for feature vec
   */
  public FeatureVec(double vec[])
  {
    this.vec = vec.clone();
  }

  /**
   * Duplicate the given feature vec
   * 
   * @param fv feature vec to duplicate
   */
  public FeatureVec(FeatureVec fv)
  {
    vec = fv.vec.clone();
    name = fv.name;
  }

  /**
   * Create a feature vector with 'nDims' using the supplied values; if none are given, the vector is all zeros.
   */
  public FeatureVec(int nDims, double... x)
  {
    assert x.length == nDims || x.length == 0;
    if (x.length == 0) {
      vec = new double[nDims];
    } else {
      vec = Arrays.copyOf(x, nDims);
    }
  }

  public String getName()
  {
    return name;
  }

  public FeatureVec setName(String name)
  {
    this.name = name;
    return this;
  }

  /** @return dimensionality of this feature vector */
  public int getNumDims()
  {
    return vec.length;
  }

  /** @return vector data as a double array (actual reference, not a copy!) */
  public double[] get()
  {
    return vec;
  }

  /** @return vector data as a double array (copy of internal data) */
  public double[] toArray()
  {
    return vec.clone();
  }

  /** @return value of d^{th} dimension */
  public double get(int d)
  {
    return vec[d];
  }

  /** set the value of the d^{th} dimension to v */
  public void set(int d, double v)
  {
    vec[d] = v;
  }

  public FeatureVec dup()
  {
    return new FeatureVec(this);
  }

  public static FeatureVec zeros(int n)
  {
    return new FeatureVec(n);
  }

  /**
   * @return sum of elements of this feature vec
   */
  public double sum()
  {
    double v = 0;
    for (int i = 0; i < vec.length; i++)
      v += vec[i];
    return v;
  }

  /** @return smallest value in this vector */
  public double min()
  {
    double v = Double.POSITIVE_INFINITY;
    for (int i = 0; i < vec.length; i++)
      v = Math.min(v, vec[i]);
    return v;
  }

  /** @return index of the largest value; the first one wins on ties */
  public int argmax()
  {
    return Library.argmax(vec);
  }

  /**
   * in-place subtraction
   * 
   * @param fv vector to subtract
   */
  public FeatureVec _sub(FeatureVec fv)
  {
    int n = getNumDims();
    assert n == fv.getNumDims() : String.format("this.nDims=%d  fv.nDims=%d\n", n, fv.getNumDims());
    for (int i = 0; i < n; i++)
      vec[i] -= fv.get(i);
    return this;
  }

  /**
   * in-place multiplication
   * 
   * @param x multiplier
   */
  public FeatureVec _mul(double x)
  {
    int n = getNumDims();
    for (int i = 0; i < n; i++)
      vec[i] *= x;
    return this;
  }

  /**
   * in-place absolute value
   */
  public FeatureVec _abs()
  {
    int n = getNumDims();
    for (int i = 0; i < n; i++)
      vec[i] = Math.abs(vec[i]);
    return this;
  }

  /**
   * in-place squaring of elements
   */
  public FeatureVec _sqr()
  {
    int n = getNumDims();
    for (int i = 0; i < n; i++)
      vec[i] = vec[i] * vec[i];
    return this;
  }

  /** in-place power of elements */
  public FeatureVec _pow(double p)
  {
    int n = getNumDims();
    for (int i = 0; i < n; i++)
      vec[i] = FastMath.pow(vec[i], p);
    return this;
  }

  /** Replace NaN dimensions with zero, in place. */
  public FeatureVec _missingToZero()
  {
    int n = getNumDims();
    for (int i = 0; i < n; i++)
      if (Double.isNaN(vec[i])) vec[i] = 0.0;
    return this;
  }

  /** @return new vector representing difference of this vector and the given vector */
  public FeatureVec sub(FeatureVec fv)
  {
    return new FeatureVec(this)._sub(fv);
  }

  /** @return dot product of this vector and the given vector. */
  public double dot(FeatureVec fv)
  {
    int n = getNumDims();
    assert n == fv.getNumDims();
    double ret = 0.0;
    for (int i = 0; i < n; i++)
      ret += vec[i] * fv.vec[i];
    return ret;
  }

  @Override
  public String toString()
  {
    if (vec.length == 0) return "[]";
    StringBuffer sb = new StringBuffer();
    sb.append(String.format("[%.3f", vec[0]));
    for (int i = 1; i < vec.length; i++)
      sb.append(String.format(",%.3f", vec[i]));
    sb.append("]");
    return sb.toString();
  }
}
