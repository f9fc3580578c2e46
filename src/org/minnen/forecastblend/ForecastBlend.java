package org.minnen.forecastblend;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.minnen.forecastblend.align.AlignedData;
import org.minnen.forecastblend.align.IntersectAligner;
import org.minnen.forecastblend.align.UnionAligner;
import org.minnen.forecastblend.data.FeatureBundle;
import org.minnen.forecastblend.estimate.Estimators;
import org.minnen.forecastblend.estimate.PostProcessEstimator;
import org.minnen.forecastblend.extract.FeatureMap;
import org.minnen.forecastblend.io.BlendWriter;
import org.minnen.forecastblend.io.JsonStore;
import org.minnen.forecastblend.io.MemoryRecordSource;
import org.minnen.forecastblend.io.Query;
import org.minnen.forecastblend.io.RecordSource;
import org.minnen.forecastblend.io.WeightReader;
import org.minnen.forecastblend.post.MaxWeightPostProcessor;
import org.minnen.forecastblend.post.PostProcessor;

/**
 * Learns source weights (REDUCE) or writes blended forecasts and their errors (PRODUCE) for every forecast distance
 * of one city.
 * 
 * Usage: ForecastBlend REDUCE|PRODUCE [config.properties]
 */
public class ForecastBlend
{
  /** Produce always reads and writes the weights of this forecast distance. */
  public static final int    PRODUCE_DISTANCE = 0;

  private final BlendConfig  config;
  private final FeatureMap   featureMap;
  private final RecordSource records;
  private final WeightReader reader;
  private final BlendWriter  writer;

  public ForecastBlend(BlendConfig config, RecordSource records, WeightReader reader, BlendWriter writer)
  {
    this.config = config;
    this.featureMap = config.buildFeatureMap();
    this.records = records;
    this.reader = reader;
    this.writer = writer;
  }

  /** @return largest forecast distance to process: the configured maximum, capped by the stored data */
  public int getMaxDistance()
  {
    int stored = -1;
    for (String source : config.sources) {
      stored = Math.max(stored, records.getMaxForecastDistance(source));
    }
    return Math.min(config.maxDistance, stored);
  }

  /**
   * Learn and store weights for each forecast distance.
   * 
   * @return number of distances whose weights were written
   */
  public int reduce() throws IOException
  {
    System.out.println("Begin reducing");
    Map<String, List<PostProcessor>> weightPost = new LinkedHashMap<>();
    weightPost.put(BlendConfig.CLASS_FEATURE, Collections.singletonList(new MaxWeightPostProcessor()));

    final int maxDistance = getMaxDistance();
    int nDone = 0;
    double spent = 0;
    for (int d = 0; d <= maxDistance; ++d) {
      long start = System.currentTimeMillis();
      Query query = new Query(config.city, config.country, d, config.limit);
      try {
        UnionAligner aligner = UnionAligner.fromSource(records, config.sources, config.truth, query);
        PostProcessEstimator est = PostProcessEstimator.fromAligner(aligner, featureMap);
        est.reduce(config.reducer, weightPost);
        writer.supplement(JsonStore.slot(config.city, config.country, d));
        writer.writeWeights(est);
        ++nDone;
      } catch (BlendException e) {
        reportSkip(query, e);
      }
      spent = reportProgress(query, start, spent);
    }
    return nDone;
  }

  /**
   * Blend the newest forecasts of each distance and measure the blend against the ground truth.
   * 
   * @return number of distances whose output was written
   */
  public int produce() throws IOException
  {
    System.out.println("Begin producing");
    final int maxDistance = getMaxDistance();
    int nDone = 0;
    double spent = 0;
    for (int d = 0; d <= maxDistance; ++d) {
      long start = System.currentTimeMillis();
      Query query = new Query(config.city, config.country, d, config.limit);
      try {
        AlignedData validation = IntersectAligner.fromSource(records, config.sources, config.truth, query)
            .align(featureMap);
        FeatureBundle data = UnionAligner.fromSource(records, config.sources, null, query).align(featureMap).predicted;

        reader.search(config.city, config.country, PRODUCE_DISTANCE);
        FeatureBundle produced = Estimators.produce(reader, data);
        FeatureBundle blended = Estimators.produce(reader, validation.predicted);
        FeatureBundle errors = Estimators.crossValidate(blended, validation.truth, config.reducer);

        writer.supplement(JsonStore.slot(config.city, config.country, PRODUCE_DISTANCE));
        writer.writeProduced(produced);
        writer.writeErrors(errors, blended.getLabels());
        reportErrors(query, errors);
        ++nDone;
      } catch (BlendException e) {
        reportSkip(query, e);
      }
      spent = reportProgress(query, start, spent);
    }
    return nDone;
  }

  private static void reportSkip(Query query, BlendException e)
  {
    System.out.printf("\n%s: %s, %s\n\n", e.getClass().getSimpleName(), query, e.getMessage());
  }

  private static double reportProgress(Query query, long start, double spent)
  {
    double sec = (System.currentTimeMillis() - start) / 1000.0;
    spent += sec;
    System.out.printf("%s was processed; %.3f/%.3f\n", query, sec, spent);
    return spent;
  }

  private static void reportErrors(Query query, FeatureBundle errors)
  {
    DescriptiveStatistics stats = new DescriptiveStatistics();
    for (String feature : errors.getFeatures()) {
      for (int i = 0; i < errors.getNumSources(); ++i) {
        double e = errors.get(feature, i, 0);
        if (!Double.isNaN(e)) stats.addValue(e);
      }
    }
    if (stats.getN() > 0) {
      System.out.printf("%s cv error: mean=%.3f  max=%.3f  (%d features)\n", query, stats.getMean(), stats.getMax(),
          errors.getFeatures().size());
    }
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 1) {
      System.err.println("Usage: ForecastBlend REDUCE|PRODUCE [config.properties]");
      System.exit(1);
    }
    File file = new File(args.length > 1 ? args[1] : BlendConfig.DEFAULT_FILE);
    BlendConfig config = BlendConfig.configure(BlendConfig.load(file));
    RecordSource records = MemoryRecordSource.load(config.dataDir, config.labelKey);
    JsonStore store = new JsonStore(config.outputDir);
    ForecastBlend blend = new ForecastBlend(config, records, store, store);

    String script = args[0].toUpperCase();
    if (script.equals("REDUCE")) {
      blend.reduce();
    } else if (script.equals("PRODUCE")) {
      blend.produce();
    } else {
      System.err.printf("Unknown command: %s (expected REDUCE or PRODUCE)\n", args[0]);
      System.exit(1);
    }
  }
}
