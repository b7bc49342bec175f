package io.streamstat.sketch;

import com.google.common.base.MoreObjects;

/**
 * One measurement: what was estimated by which estimator on which dataset, against the exact value.
 */
public final class ResultRow
{
  final String dataset;
  final String estimator;
  final String metric;
  final double estimate;
  final double truth;

  public ResultRow(String dataset, String estimator, String metric, double estimate, double truth)
  {
    this.dataset = dataset;
    this.estimator = estimator;
    this.metric = metric;
    this.estimate = estimate;
    this.truth = truth;
  }

  /**
   * @return relative error in percent, NaN if the true value is 0 but the estimate is not
   */
  public double errorPct()
  {
    if (truth == 0) {
      return estimate == 0 ? 0.0 : Double.NaN;
    }
    return 100.0 * Math.abs(estimate - truth) / truth;
  }

  public String dataset()
  {
    return dataset;
  }

  public String estimator()
  {
    return estimator;
  }

  public String metric()
  {
    return metric;
  }

  public double estimate()
  {
    return estimate;
  }

  public double truth()
  {
    return truth;
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
        .add("dataset", dataset)
        .add("estimator", estimator)
        .add("metric", metric)
        .add("estimate", estimate)
        .add("truth", truth)
        .toString();
  }
}
