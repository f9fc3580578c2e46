package org.minnen.forecastblend.tests;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;
import org.minnen.forecastblend.EmptyPredictionException;
import org.minnen.forecastblend.LabelCountMismatchException;
import org.minnen.forecastblend.ShapeMismatchException;
import org.minnen.forecastblend.data.FeatureBundle;
import org.minnen.forecastblend.data.FeatureVec;
import org.minnen.forecastblend.data.WeightSet;
import org.minnen.forecastblend.estimate.Estimators;
import org.minnen.forecastblend.estimate.PostProcessEstimator;
import org.minnen.forecastblend.estimate.StandardEstimator;
import org.minnen.forecastblend.ml.distance.EuclideanReducer;
import org.minnen.forecastblend.post.MaxWeightPostProcessor;
import org.minnen.forecastblend.post.PostProcessor;
import org.minnen.forecastblend.util.Library;

public class TestStandardEstimator
{
  final double        eps    = 1e-9;

  final List<String>  labels = Fixtures.labels("2020-01-01", "2020-01-02", "2020-01-03");
  final FeatureBundle data   = Fixtures.bundle(labels, new double[] { 1, 2, 3 }, new double[] { 2, 3, 4 },
      new double[] { 4, 4, 4 });
  final FeatureBundle truth  = Fixtures.bundle(Fixtures.labels("real"), labels, new double[] { 1, 2, 3 });

  @Test
  public void testReduce()
  {
    StandardEstimator est = new StandardEstimator(data, truth);
    assertTrue(est.getWeights().isEmpty());

    WeightSet weights = est.reduce();
    FeatureVec w = weights.get("t");
    assertArrayEquals(new double[] { 0.5, 7.0 / 17.0, 3.0 / 34.0 }, w.get(), eps);
    assertEquals(1.0, w.sum(), eps);
    assertSame(weights, est.getWeights());
    assertEquals(Fixtures.labels("s1", "s2", "s3"), est.getSources());
  }

  @Test
  public void testBestSourceGetsLargestWeight()
  {
    FeatureVec w = new StandardEstimator(data, truth).reduce().get("t");
    assertTrue(w.get(0) > w.get(1));
    assertTrue(w.get(1) > w.get(2));
    for (int i = 0; i < w.getNumDims(); ++i) {
      assertTrue(w.get(i) >= 0);
    }
  }

  @Test
  public void testAllSourcesPerfect()
  {
    FeatureBundle perfect = Fixtures.bundle(labels, new double[] { 1, 2, 3 }, new double[] { 1, 2, 3 });
    FeatureVec w = new StandardEstimator(perfect, truth).reduce().get("t");
    assertArrayEquals(new double[] { 1, 0 }, w.get(), eps);
  }

  @Test
  public void testMissingPredictionCountsAsZero()
  {
    FeatureBundle gappy = Fixtures.bundle(labels, new double[] { 1, Double.NaN, 3 }, new double[] { 1, 2, 5 });
    FeatureVec w = new StandardEstimator(gappy, truth).reduce().get("t");
    // Errors are 4/3 for both sources.
    assertArrayEquals(new double[] { 0.5, 0.5 }, w.get(), eps);
  }

  @Test
  public void testProduce()
  {
    StandardEstimator est = new StandardEstimator(data, truth);
    est.reduce();
    FeatureBundle produced = est.produce(data);

    assertEquals(Collections.singletonList(Estimators.BLENDED), produced.getSources());
    assertEquals(labels, produced.getLabels());
    double expected = 0.5 * 1 + 7.0 / 17.0 * 2 + 3.0 / 34.0 * 4;
    assertEquals(expected, produced.get("t", 0, 0), eps);

    // Each blended value lies between the smallest and largest prediction.
    double[][] m = data.getMatrix("t");
    for (int j = 0; j < labels.size(); ++j) {
      double lo = Math.min(m[0][j], Math.min(m[1][j], m[2][j]));
      double hi = Math.max(m[0][j], Math.max(m[1][j], m[2][j]));
      assertTrue(produced.get("t", 0, j) >= lo - eps);
      assertTrue(produced.get("t", 0, j) <= hi + eps);
    }
  }

  @Test
  public void testProduceLeavesInputUntouched()
  {
    FeatureBundle gappy = Fixtures.bundle(labels, new double[] { 1, Double.NaN, 3 }, new double[] { 1, 2, 5 });
    StandardEstimator est = new StandardEstimator(gappy, truth);
    est.reduce();
    FeatureBundle produced = est.produce(gappy);

    assertTrue(Double.isNaN(gappy.get("t", 0, 1)));
    assertEquals(1.0, produced.get("t", 0, 1), eps);
  }

  @Test
  public void testFeatureWithoutWeightsIsOmitted()
  {
    Map<String, double[][]> matrices = new LinkedHashMap<>();
    matrices.put("t", new double[][] { { 1, 2 }, { 3, 4 } });
    matrices.put("u", new double[][] { { 5, 6 }, { 7, 8 } });
    FeatureBundle both = new FeatureBundle(matrices, Fixtures.labels("s1", "s2"), Fixtures.labels("a", "b"));

    Map<String, FeatureVec> w = new LinkedHashMap<>();
    w.put("t", new FeatureVec(new double[] { 0.25, 0.75 }));
    FeatureBundle produced = Estimators.combine(new WeightSet(both.getSources(), w), both);

    assertEquals(Collections.singleton("t"), produced.getFeatures());
    assertArrayEquals(new double[] { 2.5, 3.5 }, produced.getMatrix("t")[0], eps);
  }

  @Test
  public void testSetWeights()
  {
    Map<String, FeatureVec> w = new LinkedHashMap<>();
    w.put("t", new FeatureVec(new double[] { 0, 0, 1 }));
    StandardEstimator est = new StandardEstimator(data, null);
    est.setWeights(new WeightSet(data.getSources(), w));
    assertArrayEquals(new double[] { 4, 4, 4 }, est.produce(data).getMatrix("t")[0], eps);
  }

  @Test(expected = IllegalStateException.class)
  public void testReduceWithoutTruth()
  {
    new StandardEstimator(data, null).reduce();
  }

  @Test(expected = EmptyPredictionException.class)
  public void testEmptyPredictions()
  {
    FeatureBundle empty = Fixtures.bundle(Fixtures.labels(), new double[0], new double[0]);
    FeatureBundle noTruth = Fixtures.bundle(Fixtures.labels("real"), Fixtures.labels(), new double[0]);
    new StandardEstimator(empty, noTruth).reduce();
  }

  @Test(expected = LabelCountMismatchException.class)
  public void testTruthLabelCountMismatch()
  {
    FeatureBundle shortTruth = Fixtures.bundle(Fixtures.labels("real"), Fixtures.labels("a", "b"),
        new double[] { 1, 2 });
    new StandardEstimator(data, shortTruth).reduce();
  }

  @Test(expected = ShapeMismatchException.class)
  public void testTruthWithoutFeature()
  {
    Map<String, double[][]> matrices = new LinkedHashMap<>();
    matrices.put("u", new double[][] { { 1, 2, 3 } });
    new StandardEstimator(data, new FeatureBundle(matrices, Fixtures.labels("real"), labels)).reduce();
  }

  @Test(expected = ShapeMismatchException.class)
  public void testWeightsForOtherSources()
  {
    Map<String, FeatureVec> w = new LinkedHashMap<>();
    w.put("t", new FeatureVec(new double[] { 0.5, 0.5 }));
    Estimators.combine(new WeightSet(Fixtures.labels("s1", "s2"), w), data);
  }

  @Test
  public void testPostProcessWeights()
  {
    PostProcessEstimator est = new PostProcessEstimator(data, truth);
    Map<String, List<PostProcessor>> post = new LinkedHashMap<>();
    post.put("t", Arrays.asList(new MaxWeightPostProcessor()));

    WeightSet weights = est.reduce(new EuclideanReducer(), post);
    assertArrayEquals(new double[] { 1, 0, 0 }, weights.get("t").get(), eps);
    assertSame(weights, est.getWeights());

    // Produced values now come from the first source alone.
    assertArrayEquals(new double[] { 1, 2, 3 }, est.produce(data).getMatrix("t")[0], eps);
  }

  @Test
  public void testPostProcessProduced()
  {
    PostProcessEstimator est = new PostProcessEstimator(data, truth);
    est.reduce(new EuclideanReducer(), null);
    assertEquals(1.0, Library.sum(est.getWeights().get("t").get()), eps);

    Map<String, List<PostProcessor>> post = new LinkedHashMap<>();
    post.put("t", Arrays.asList((PostProcessor) v -> v.dup()._mul(2)));
    FeatureBundle doubled = est.produce(data, post);
    FeatureBundle plain = est.produce(data);
    assertEquals(2 * plain.get("t", 0, 2), doubled.get("t", 0, 2), eps);
    assertEquals(Estimators.BLENDED, doubled.getSources().get(0));
  }
}
