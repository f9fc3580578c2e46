package org.minnen.forecastblend.estimate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.minnen.forecastblend.EmptyPredictionException;
import org.minnen.forecastblend.LabelCountMismatchException;
import org.minnen.forecastblend.MissingWeightsException;
import org.minnen.forecastblend.ShapeMismatchException;
import org.minnen.forecastblend.data.FeatureBundle;
import org.minnen.forecastblend.data.FeatureVec;
import org.minnen.forecastblend.data.WeightSet;
import org.minnen.forecastblend.io.WeightReader;
import org.minnen.forecastblend.ml.distance.Reducer;
import org.minnen.forecastblend.util.Library;

/** Weight learning, combination and cross-validation over feature bundles. */
public final class Estimators
{
  /** Source name of the single row in a produced bundle. */
  public static final String BLENDED = "blended";

  /** Label of the single column in an error bundle. */
  public static final String ERROR   = "error";

  private Estimators()
  {}

  /**
   * Learn one weight vector per feature.
   * 
   * Missing predictions count as zero. Each source's error is its distance to the truth divided by the number of
   * labels; errors are then reverse-normalized so that the weights sum to one and shrink as the error grows.
   */
  public static WeightSet learn(FeatureBundle predicted, FeatureBundle truth, Reducer reducer)
  {
    Map<String, FeatureVec> weights = new LinkedHashMap<>();
    for (String feature : predicted.getFeatures()) {
      checkPredictions(feature, predicted);
      FeatureVec errors = errors(feature, predicted, truth, reducer);
      weights.put(feature, new FeatureVec(Library.reverseNormalize(errors.get())));
    }
    return new WeightSet(predicted.getSources(), weights);
  }

  /**
   * Weighted sum of the sources for every label.
   * 
   * Features without learned weights are left out of the result. The input bundle is not modified.
   * 
   * @return bundle with a single row ({@link #BLENDED}) per feature
   */
  public static FeatureBundle combine(WeightSet weights, FeatureBundle data)
  {
    final int nLabels = data.getNumLabels();
    Map<String, double[][]> result = new LinkedHashMap<>();
    for (String feature : data.getFeatures()) {
      double[][] m = data.getMatrix(feature);
      int nCols = m.length == 0 ? nLabels : m[0].length;
      if (nCols != nLabels) {
        throw new LabelCountMismatchException(
            "Matrix of predictions for '%s' has %d columns but %d labels are expected (sources %s)", feature, nCols,
            nLabels, data.getSources());
      }
      FeatureVec w = weights.get(feature);
      if (w == null) continue;
      if (w.getNumDims() != m.length) {
        throw new ShapeMismatchException("Weights for '%s' cover %d sources but the data has %d rows", feature,
            w.getNumDims(), m.length);
      }
      Library.missingToZero(m);
      double[] row = new double[nLabels];
      FeatureVec column = new FeatureVec(m.length);
      for (int j = 0; j < nLabels; ++j) {
        for (int i = 0; i < m.length; ++i) {
          column.set(i, m[i][j]);
        }
        row[j] = w.dot(column);
      }
      result.put(feature, new double[][] { row });
    }
    return new FeatureBundle(result, Collections.singletonList(BLENDED), data.getLabels());
  }

  /**
   * Per-source error of the data against the truth, measured the same way {@link #learn} measures it.
   * 
   * @return bundle with one row per source and a single {@link #ERROR} column
   */
  public static FeatureBundle crossValidate(FeatureBundle data, FeatureBundle truth, Reducer reducer)
  {
    Map<String, double[][]> result = new LinkedHashMap<>();
    for (String feature : data.getFeatures()) {
      FeatureVec errors = errors(feature, data, truth, reducer);
      double[][] m = new double[errors.getNumDims()][];
      for (int i = 0; i < m.length; ++i) {
        m[i] = new double[] { errors.get(i) };
      }
      result.put(feature, m);
    }
    return new FeatureBundle(result, data.getSources(), Collections.singletonList(ERROR));
  }

  /**
   * Combine the data using the weights stored for the reader's current slot.
   * 
   * @throws MissingWeightsException if no weights were stored for the slot
   */
  public static FeatureBundle produce(WeightReader reader, FeatureBundle data)
  {
    WeightSet weights = reader.readWeights();
    if (weights == null) {
      throw new MissingWeightsException("There are no weights for %s; were weights reduced for this slot?",
          reader.slot());
    }
    return combine(weights, data);
  }

  private static void checkPredictions(String feature, FeatureBundle predicted)
  {
    List<String> labels = predicted.getLabels();
    int nCols = predicted.getNumSources() == 0 ? labels.size() : predicted.getMatrix(feature)[0].length;
    if (nCols == 0) {
      throw new EmptyPredictionException("Matrix of predictions for '%s' is empty (size %d, expected %d labels)",
          feature, nCols, labels.size());
    }
    if (nCols != labels.size()) {
      throw new LabelCountMismatchException(
          "Matrix of predictions for '%s' has %d columns but %d labels are expected (sources %s)", feature, nCols,
          labels.size(), predicted.getSources());
    }
  }

  /** @return distance of each (missing-as-zero) source row to the truth, divided by the number of truth labels */
  private static FeatureVec errors(String feature, FeatureBundle data, FeatureBundle truth, Reducer reducer)
  {
    if (!truth.hasFeature(feature)) {
      throw new ShapeMismatchException("Ground truth has no values for '%s' (truth features %s)", feature,
          truth.getFeatures());
    }
    if (truth.getNumSources() != 1) {
      throw new ShapeMismatchException("Ground truth for '%s' must have a single row, not %d", feature,
          truth.getNumSources());
    }
    FeatureVec y = truth.getRow(feature, 0);
    final int nLabels = y.getNumDims();
    if (data.getNumLabels() != nLabels) {
      throw new LabelCountMismatchException(
          "Matrix of predictions for '%s' has %d columns but the ground truth has %d labels", feature,
          data.getNumLabels(), nLabels);
    }
    FeatureVec errors = new FeatureVec(data.getNumSources());
    for (int i = 0; i < data.getNumSources(); ++i) {
      FeatureVec v = data.getRow(feature, i)._missingToZero();
      errors.set(i, nLabels == 0 ? 0.0 : reducer.distance(v, y) / nLabels);
    }
    return errors;
  }
}
