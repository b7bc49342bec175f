package io.streamstat.sketch;

import com.google.common.base.Splitter;
import com.google.common.base.Supplier;

import java.util.List;

/**
 * Creates string estimators by name.
 * <ul>
 *   <li>{@code hll<log2m>}, e.g. {@code hll14} for 16384 registers, {@code hll} for the default
 *   <li>{@code sbf<k>x<m>}, e.g. {@code sbf3x1024}, {@code sbf} for the default
 * </ul>
 */
public final class Estimators
{
  static final int DEFAULT_PRECISION = 14;
  static final int DEFAULT_HASH_FUNCTIONS = 10;
  static final int DEFAULT_BUCKETS = 10_000_000;

  private static final String HLL_PREFIX = "hll";
  private static final String SBF_PREFIX = "sbf";

  private Estimators()
  {
  }

  public static boolean isCardinalityEstimator(String name)
  {
    return name.startsWith(HLL_PREFIX);
  }

  public static boolean isFrequencyEstimator(String name)
  {
    return name.startsWith(SBF_PREFIX);
  }

  public static CardinalityEstimator<String> cardinality(String name)
  {
    if (!isCardinalityEstimator(name)) {
      throw new IllegalArgumentException("Unknown cardinality estimator : " + name);
    }
    String pStr = name.substring(HLL_PREFIX.length());
    int precision = pStr.isEmpty() ? DEFAULT_PRECISION : parse(name, pStr);
    if (precision < 0 || precision > 30) {
      throw new IllegalArgumentException("invalid precision [" + precision + "] in " + name + " : should be in [0, 30]");
    }
    return HyperLogLog.forStrings(1 << precision);
  }

  public static FrequencyEstimator<String> frequency(String name)
  {
    if (!isFrequencyEstimator(name)) {
      throw new IllegalArgumentException("Unknown frequency estimator : " + name);
    }
    String shape = name.substring(SBF_PREFIX.length());
    if (shape.isEmpty()) {
      return SpectralBloomFilter.forStrings(DEFAULT_HASH_FUNCTIONS, DEFAULT_BUCKETS);
    }
    List<String> parts = Splitter.on('x').splitToList(shape);
    if (parts.size() != 2) {
      throw new IllegalArgumentException("Unknown frequency estimator : " + name + ", expected sbf<k>x<m>");
    }
    return SpectralBloomFilter.forStrings(parse(name, parts.get(0)), parse(name, parts.get(1)));
  }

  public static Supplier<CardinalityEstimator<String>> lazyCardinality(String name)
  {
    return () -> cardinality(name);
  }

  public static Supplier<FrequencyEstimator<String>> lazyFrequency(String name)
  {
    return () -> frequency(name);
  }

  private static int parse(String name, String number)
  {
    try {
      return Integer.parseInt(number);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Unknown estimator : " + name, e);
    }
  }
}
