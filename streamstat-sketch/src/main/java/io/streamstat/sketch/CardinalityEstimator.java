package io.streamstat.sketch;

public interface CardinalityEstimator<T>
{
  void add(T element);

  double cardinality(boolean useBiasCorrection);

  default double cardinality()
  {
    return cardinality(true);
  }

  long memoryFootprint();

  String name();
}
