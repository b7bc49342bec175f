package io.streamstat.sketch;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.hash.Funnel;
import com.google.common.hash.HashFunction;

import java.util.Arrays;
import java.util.OptionalLong;

/**
 * Spectral Bloom filter with the minimum-selection query, see
 * https://theory.stanford.edu/~matias/papers/sbf-sigmod-03.pdf.
 *
 * <p>A single array of {@code m} counters is shared by {@code k} seeded hash functions. Every
 * insertion increments {@code k} counters, a query returns the smallest of them, so the estimate is
 * never below the true frequency.
 *
 * <p>Not thread-safe.
 */
public class SpectralBloomFilter<T> implements FrequencyEstimator<T>
{
  private final int k;
  private final int m;
  private final HashFunction[] probes;
  private final Funnel<? super T> funnel;

  private final long[] counters;
  private long insertions;

  public SpectralBloomFilter(int hashFunctionCount, int bucketCount, Funnel<? super T> funnel)
  {
    Preconditions.checkArgument(
        hashFunctionCount > 0,
        "invalid hash function count [%s] : should be positive",
        hashFunctionCount
    );
    Preconditions.checkArgument(bucketCount > 0, "invalid bucket count [%s] : should be positive", bucketCount);
    this.k = hashFunctionCount;
    this.m = bucketCount;
    this.probes = ElementHashing.probeFamily(hashFunctionCount);
    this.funnel = Preconditions.checkNotNull(funnel, "funnel");
    this.counters = new long[bucketCount];
  }

  public static SpectralBloomFilter<String> forStrings(int hashFunctionCount, int bucketCount)
  {
    return new SpectralBloomFilter<>(hashFunctionCount, bucketCount, ElementHashing.STRING_FUNNEL);
  }

  private int bucket(T element, int probe)
  {
    return Math.floorMod(probes[probe].hashObject(element, funnel).asInt(), m);
  }

  @Override
  public void add(T element)
  {
    for (int i = 0; i < k; i++) {
      counters[bucket(element, i)]++;
    }
    insertions++;
  }

  @Override
  public double estimatedFrequency(T element, boolean applyCorrection, OptionalLong insertedCount)
  {
    long minCount = Long.MAX_VALUE;
    for (int i = 0; i < k; i++) {
      minCount = Math.min(minCount, counters[bucket(element, i)]);
    }
    if (!applyCorrection) {
      return minCount;
    }

    Preconditions.checkArgument(
        insertedCount != null && insertedCount.isPresent(),
        "insertedCount is required when applying the bias correction"
    );
    return Math.max(0.0d, minCount - expectedBias(insertedCount.getAsLong()));
  }

  /**
   * Expected collision-induced inflation of a counter after {@code n} insertions,
   * {@code (1 - e^(-kn/m))^k}. It does not depend on the queried element.
   *
   * @throws IllegalArgumentException if {@code n} is negative
   */
  public double expectedBias(long n)
  {
    Preconditions.checkArgument(n >= 0, "invalid inserted count [%s] : should not be negative", n);
    if (n == 0) {
      return 0;
    }
    return Math.pow(1 - Math.exp(-(double) k * n / m), k);
  }

  @Override
  public long insertions()
  {
    return insertions;
  }

  public int hashFunctionCount()
  {
    return k;
  }

  public int bucketCount()
  {
    return m;
  }

  @VisibleForTesting
  long[] counters()
  {
    return Arrays.copyOf(counters, counters.length);
  }

  @Override
  public long memoryFootprint()
  {
    return (long) Long.BYTES * counters.length;
  }

  @Override
  public String name()
  {
    return "sbf" + k + "x" + m;
  }
}
