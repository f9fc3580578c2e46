package org.minnen.forecastblend.tests;

import static org.junit.Assert.*;

import java.util.Collections;
import java.util.List;

import org.junit.Test;
import org.minnen.forecastblend.LabelCountMismatchException;
import org.minnen.forecastblend.data.FeatureBundle;
import org.minnen.forecastblend.estimate.Estimators;
import org.minnen.forecastblend.ml.distance.EuclideanReducer;
import org.minnen.forecastblend.ml.distance.MinkowskiReducer;

public class TestCrossValidation
{
  final double        eps    = 1e-9;

  final List<String>  labels = Fixtures.labels("2020-01-01", "2020-01-02", "2020-01-03");
  final FeatureBundle data   = Fixtures.bundle(labels, new double[] { 1, 2, 3 }, new double[] { 2, 3, 4 },
      new double[] { 4, 4, 4 });
  final FeatureBundle truth  = Fixtures.bundle(Fixtures.labels("real"), labels, new double[] { 1, 2, 3 });

  @Test
  public void testErrorsPerSource()
  {
    FeatureBundle errors = Estimators.crossValidate(data, truth, new EuclideanReducer());

    assertEquals(data.getSources(), errors.getSources());
    assertEquals(Collections.singletonList(Estimators.ERROR), errors.getLabels());
    assertEquals(0, errors.get("t", 0, 0), eps);
    assertEquals(1, errors.get("t", 1, 0), eps);
    assertEquals(14.0 / 3.0, errors.get("t", 2, 0), eps);
  }

  @Test
  public void testErrorsWithOtherReducer()
  {
    FeatureBundle errors = Estimators.crossValidate(data, truth, new MinkowskiReducer());
    assertEquals(2, errors.get("t", 2, 0), eps);
  }

  @Test
  public void testBlendedError()
  {
    FeatureBundle blended = Fixtures.bundle(Collections.singletonList(Estimators.BLENDED), labels,
        new double[] { 2, 3, 4 });
    FeatureBundle errors = Estimators.crossValidate(blended, truth, new EuclideanReducer());
    assertEquals(1, errors.getNumSources());
    assertEquals(1, errors.get("t", 0, 0), eps);
  }

  @Test(expected = LabelCountMismatchException.class)
  public void testLabelCountMismatch()
  {
    FeatureBundle shortTruth = Fixtures.bundle(Fixtures.labels("real"), Fixtures.labels("a"), new double[] { 1 });
    Estimators.crossValidate(data, shortTruth, new EuclideanReducer());
  }
}
