package io.streamstat.sketch;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.OptionalLong;

/**
 * Feeds one element stream to a set of named estimators and to an exact tally, then compares.
 *
 * <p>Cardinality estimators report {@code cardinality} (bias corrected) and {@code cardinality_raw}
 * against the number of distinct elements. Frequency estimators report {@code avg_frequency} and
 * {@code avg_frequency_corrected}, the mean estimated frequency over all distinct elements, against
 * {@code total / distinct}.
 */
public class EstimatorComparison
{
  private static final Logger LOG = LoggerFactory.getLogger(EstimatorComparison.class);

  static final String CARDINALITY = "cardinality";
  static final String CARDINALITY_RAW = "cardinality_raw";
  static final String AVG_FREQUENCY = "avg_frequency";
  static final String AVG_FREQUENCY_CORRECTED = "avg_frequency_corrected";

  private final List<CardinalityEstimator<String>> cardinalityEstimators = new ArrayList<>();
  private final List<FrequencyEstimator<String>> frequencyEstimators = new ArrayList<>();

  public EstimatorComparison(Iterable<String> estimatorNames)
  {
    for (String name : estimatorNames) {
      if (Estimators.isCardinalityEstimator(name)) {
        cardinalityEstimators.add(Estimators.cardinality(name));
      } else if (Estimators.isFrequencyEstimator(name)) {
        frequencyEstimators.add(Estimators.frequency(name));
      } else {
        throw new IllegalArgumentException("Unknown estimator : " + name);
      }
    }
    Preconditions.checkArgument(
        !cardinalityEstimators.isEmpty() || !frequencyEstimators.isEmpty(),
        "at least one estimator is needed"
    );
  }

  public List<ResultRow> run(String dataset, Iterator<String> elements)
  {
    final Stopwatch stopwatch = Stopwatch.createStarted();
    final Multiset<String> truth = HashMultiset.create();

    while (elements.hasNext()) {
      String element = elements.next();
      truth.add(element);
      for (CardinalityEstimator<String> estimator : cardinalityEstimators) {
        estimator.add(element);
      }
      for (FrequencyEstimator<String> estimator : frequencyEstimators) {
        estimator.add(element);
      }
    }
    LOG.info("Ingested {} elements ({} distinct) of {} in {}", truth.size(), truth.elementSet().size(), dataset, stopwatch);

    final int distinct = truth.elementSet().size();
    final long total = truth.size();
    List<ResultRow> rows = new ArrayList<>();

    for (CardinalityEstimator<String> estimator : cardinalityEstimators) {
      rows.add(new ResultRow(dataset, estimator.name(), CARDINALITY, estimator.cardinality(true), distinct));
      rows.add(new ResultRow(dataset, estimator.name(), CARDINALITY_RAW, estimator.cardinality(false), distinct));
    }

    final double trueAverage = distinct == 0 ? 0.0 : total / (double) distinct;
    for (FrequencyEstimator<String> estimator : frequencyEstimators) {
      final OptionalLong inserted = OptionalLong.of(estimator.insertions());
      double sum = 0.0;
      double correctedSum = 0.0;
      for (String element : truth.elementSet()) {
        sum += estimator.estimatedFrequency(element);
        correctedSum += estimator.estimatedFrequency(element, true, inserted);
      }
      rows.add(new ResultRow(dataset, estimator.name(), AVG_FREQUENCY, average(sum, distinct), trueAverage));
      rows.add(new ResultRow(
          dataset,
          estimator.name(),
          AVG_FREQUENCY_CORRECTED,
          average(correctedSum, distinct),
          trueAverage
      ));
    }

    for (ResultRow row : rows) {
      LOG.info("{} {} {}: estimate {} truth {} error {}%", row.dataset, row.estimator, row.metric, row.estimate, row.truth, row.errorPct());
    }
    LOG.info("Finished comparison on {} in {}", dataset, stopwatch);
    return rows;
  }

  public List<ResultRow> run(String dataset, Iterable<String> elements)
  {
    return run(dataset, elements.iterator());
  }

  private static double average(double sum, int count)
  {
    return count == 0 ? 0.0 : sum / count;
  }
}
