package io.streamstat.sketch;

import java.util.OptionalLong;

public interface FrequencyEstimator<T>
{
  void add(T element);

  /**
   * @param insertedCount total number of insertions so far, required when {@code applyCorrection} is set
   * @throws IllegalArgumentException if a correction is requested without {@code insertedCount}
   */
  double estimatedFrequency(T element, boolean applyCorrection, OptionalLong insertedCount);

  default double estimatedFrequency(T element)
  {
    return estimatedFrequency(element, false, OptionalLong.empty());
  }

  long insertions();

  long memoryFootprint();

  String name();
}
