package org.minnen.forecastblend.tests;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.minnen.forecastblend.BlendConfig;
import org.minnen.forecastblend.ConfigurationException;
import org.minnen.forecastblend.ForecastBlend;
import org.minnen.forecastblend.data.WeightSet;
import org.minnen.forecastblend.io.JsonStore;
import org.minnen.forecastblend.io.MemoryRecordSource;
import org.minnen.forecastblend.ml.distance.MinkowskiReducer;

public class TestForecastBlend
{
  final double          eps = 1e-6;

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  MemoryRecordSource    records;
  JsonStore             store;

  /** Five days of observations; gismeteo is one degree off, meteoprog three degrees off and wrong about snow. */
  @Before
  public void setUp() throws IOException
  {
    records = new MemoryRecordSource("weather_date");
    for (int day = 1; day <= 5; ++day) {
      String date = String.format("2020-01-%02d", day);
      double t = 9 + day;
      records.add("actual_weather", Fixtures.record(date, 0, t, t - 10, "rain"));
      records.add("gismeteo", Fixtures.record(date, 0, t + 1, t - 9, "light rain"));
      records.add("meteoprog", Fixtures.record(date, 0, t + 3, t - 7, "snow"));
    }
    Clock clock = Clock.fixed(Instant.parse("2020-01-06T08:00:00Z"), ZoneOffset.UTC);
    store = new JsonStore(folder.newFolder("output"), clock);
  }

  private Configuration config()
  {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("blend.sources", "gismeteo, meteoprog");
    config.addProperty("blend.truth", "actual_weather");
    config.addProperty("blend.city", Fixtures.CITY);
    config.addProperty("blend.country", Fixtures.COUNTRY);
    config.addProperty("blend.maxDistance", 1);
    config.addProperty("blend.features", "temperature_max:temperature.max, temperature_min:temperature.min");
    config.addProperty("blend.classes.sun", 1);
    config.addProperty("blend.classes.cloud", 2);
    config.addProperty("blend.classes.rain", 3);
    config.addProperty("blend.classes.snow", 7);
    return config;
  }

  private ForecastBlend blend()
  {
    return new ForecastBlend(BlendConfig.configure(config()), records, store, store);
  }

  @Test
  public void testReduce() throws IOException
  {
    ForecastBlend blend = blend();
    assertEquals(0, blend.getMaxDistance());
    assertEquals(1, blend.reduce());

    store.search(Fixtures.CITY, Fixtures.COUNTRY, 0);
    WeightSet weights = store.readWeights();
    assertEquals(Fixtures.labels("gismeteo", "meteoprog"), weights.getSources());
    assertArrayEquals(new double[] { 0.9, 0.1 }, weights.get("temperature_max").get(), eps);
    assertArrayEquals(new double[] { 0.9, 0.1 }, weights.get("temperature_min").get(), eps);
    assertArrayEquals(new double[] { 1, 0 }, weights.get(BlendConfig.CLASS_FEATURE).get(), eps);

    // Reducing again on the same day replaces the stored weights.
    blend.reduce();
    assertEquals(1, store.load(JsonStore.WEIGHTS).length());
  }

  @Test
  public void testReduceThenProduce() throws IOException
  {
    ForecastBlend blend = blend();
    blend.reduce();
    assertEquals(1, blend.produce());

    JSONArray produced = store.load(JsonStore.PRODUCED);
    assertEquals(5, produced.length());
    JSONObject first = produced.getJSONObject(0);
    assertEquals("2020-01-01", first.getString(JsonStore.LABEL));
    assertEquals(0, first.getInt(JsonStore.FORECAST_DISTANCE));
    assertEquals("2020-01-06", first.getString(JsonStore.UPDATED));
    JSONObject data = first.getJSONObject(JsonStore.DATA);
    assertEquals(11.2, data.getDouble("temperature_max"), eps);
    assertEquals(1.2, data.getDouble("temperature_min"), eps);
    assertEquals(3, data.getDouble(BlendConfig.CLASS_FEATURE), eps);

    JSONArray errors = store.load(JsonStore.ERRORS);
    assertEquals(5, errors.length());
    JSONObject e = errors.getJSONObject(0).getJSONObject(JsonStore.DATA);
    assertEquals(1.44, e.getJSONArray("temperature_max").getDouble(0), eps);
    assertEquals(0, e.getJSONArray(BlendConfig.CLASS_FEATURE).getDouble(0), eps);
  }

  @Test
  public void testProduceWithoutWeights() throws IOException
  {
    assertEquals(0, blend().produce());
    assertEquals(0, store.load(JsonStore.PRODUCED).length());
  }

  @Test
  public void testDistanceWithoutTruthIsSkipped() throws IOException
  {
    records.add("gismeteo", Fixtures.record("2020-01-07", 2, 5, 0, "sun"));
    ForecastBlend blend = blend();
    assertEquals(1, blend.getMaxDistance());
    assertEquals(1, blend.reduce());
  }

  @Test
  public void testConfigDefaults()
  {
    Configuration config = config();
    config.clearProperty("blend.features");
    BlendConfig bc = BlendConfig.configure(config);

    assertEquals(30, bc.limit);
    assertEquals("weather_date", bc.labelKey);
    assertEquals(BlendConfig.DEFAULT_FEATURES.length, bc.features.size());
    assertEquals(BlendConfig.DEFAULT_FEATURES.length + 1, bc.buildFeatureMap().size());
    assertEquals(Fixtures.labels("gismeteo", "meteoprog"), bc.sources);
  }

  @Test
  public void testLoadProperties() throws IOException
  {
    File file = FileUtils.toFile(getClass().getResource("/forecastblend-test.properties"));
    BlendConfig bc = BlendConfig.configure(BlendConfig.load(file));

    assertEquals("actual_weather", bc.truth);
    assertEquals(1, bc.maxDistance);
    assertEquals(4, bc.classes.size());
    assertEquals(7.0, ((Number) bc.classes.get("snow")).doubleValue(), eps);
    assertEquals(3, bc.buildFeatureMap().size());
  }

  @Test
  public void testReducerSetting()
  {
    Configuration config = config();
    config.setProperty("blend.reducer", "minkowski:2");
    assertEquals(2.0, ((MinkowskiReducer) BlendConfig.configure(config).reducer).getPower(), eps);
  }

  @Test(expected = ConfigurationException.class)
  public void testMissingTruth()
  {
    Configuration config = config();
    config.clearProperty("blend.truth");
    BlendConfig.configure(config);
  }

  @Test(expected = ConfigurationException.class)
  public void testBadLimit()
  {
    Configuration config = config();
    config.setProperty("blend.limit", "thirty");
    BlendConfig.configure(config);
  }

  @Test(expected = ConfigurationException.class)
  public void testBadClassValue()
  {
    Configuration config = config();
    config.setProperty("blend.classes.fog", "six");
    BlendConfig.configure(config);
  }

  @Test(expected = ConfigurationException.class)
  public void testBadFeature()
  {
    Configuration config = config();
    config.setProperty("blend.features", "temperature_max");
    BlendConfig.configure(config);
  }

  @Test(expected = IOException.class)
  public void testMissingConfigFile() throws IOException
  {
    BlendConfig.load(new File("no-such.properties"));
  }
}
