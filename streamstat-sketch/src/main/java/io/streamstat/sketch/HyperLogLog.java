package io.streamstat.sketch;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.hash.Funnel;
import com.google.common.hash.HashFunction;

import java.util.Arrays;

/**
 * Implements HyperLogLog described in http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf.
 *
 * <p>Uses 64 bits of the element hash. The least-significant {@code p = log2(m)} bits select the
 * register, the rank is the position of the first 1 in the remaining {@code 64 - p} bits counted
 * from their most-significant end.
 *
 * <p>The standard error is about {@code 1.04 / sqrt(m)}, e.g. 0.81% for {@code m = 16384}.
 *
 * <p>Not thread-safe.
 */
public class HyperLogLog<T> implements CardinalityEstimator<T>
{
  static final int HASH_BITS = Long.SIZE;
  static final int MAX_REGISTER_COUNT = 1 << 30;

  private static final double TWO_TO_THE_THIRTY_TWO = Math.pow(2, 32);
  private static final double HIGH_CORRECTION_THRESHOLD = TWO_TO_THE_THIRTY_TWO / 30.0d;

  private final int m;
  private final int p;
  private final double alpha;
  private final HashFunction hashFunction;
  private final Funnel<? super T> funnel;

  // each register actually only needs 6-bits,
  // we use `byte` here to simplify implementation
  private final byte[] registers;

  public HyperLogLog(int registerCount, Funnel<? super T> funnel)
  {
    this(registerCount, funnel, ElementHashing.defaultHash64());
  }

  public HyperLogLog(int registerCount, Funnel<? super T> funnel, HashFunction hashFunction)
  {
    Preconditions.checkArgument(
        registerCount > 0 && registerCount <= MAX_REGISTER_COUNT && Integer.bitCount(registerCount) == 1,
        "invalid register count [%s] : should be a power of two in [1, 2^30]",
        registerCount
    );
    ElementHashing.checkHashWidth(hashFunction);
    this.m = registerCount;
    this.p = Integer.numberOfTrailingZeros(registerCount);
    this.alpha = alpha(registerCount);
    this.hashFunction = hashFunction;
    this.funnel = Preconditions.checkNotNull(funnel, "funnel");
    this.registers = new byte[registerCount];
  }

  public static HyperLogLog<String> forStrings(int registerCount)
  {
    return new HyperLogLog<>(registerCount, ElementHashing.STRING_FUNNEL);
  }

  /**
   * Bias constant of the harmonic mean for {@code m} registers.
   */
  static double alpha(int m)
  {
    if (m >= 128) {
      return 0.7213 / (1 + 1.079 / m);
    }
    if (m >= 64) {
      return 0.709;
    }
    if (m >= 32) {
      return 0.697;
    }
    if (m >= 16) {
      return 0.673;
    }
    return 0.7213 / (1 + 1.079 / m);
  }

  @Override
  public void add(T element)
  {
    addHash(ElementHashing.hash64(hashFunction, funnel, element));
  }

  @VisibleForTesting
  void addHash(long hash)
  {
    final int index = (int) (hash & (m - 1));
    final long remaining = hash >>> p;

    byte rank;
    if (remaining == 0) { // very unlikely
      rank = (byte) (HASH_BITS - p + 1);
    } else {
      // `remaining` has p leading zeros from the shift
      rank = (byte) (Long.numberOfLeadingZeros(remaining) - p + 1);
    }

    // note that both operands can never be negative, so we don't need to use unsigned comparison
    if (registers[index] < rank) {
      registers[index] = rank;
    }
  }

  @Override
  public double cardinality(boolean useBiasCorrection)
  {
    double registerSum = 0.0;
    int zeros = 0;
    for (int i = 0; i < m; i++) {
      registerSum += Math.scalb(1.0, -registers[i]);
      if (registers[i] == 0) {
        zeros++;
      }
    }
    if (registerSum == 0.0) {
      return 0;
    }

    final double e = alpha * m * (double) m * (1 / registerSum);
    return useBiasCorrection ? makeCorrection(e, zeros) : e;
  }

  private double makeCorrection(double e, int zeros)
  {
    if (e <= (2.5d * m)) { // small range correction
      if (zeros > 0) {
        return m * Math.log(m / (double) zeros);
      }
      return e;
    }

    if (e <= HIGH_CORRECTION_THRESHOLD) {
      return e;
    }

    // large range correction, undefined once the estimate reaches 2^32
    final double ratio = e / TWO_TO_THE_THIRTY_TWO;
    return ratio < 1 ? -TWO_TO_THE_THIRTY_TWO * Math.log(1 - ratio) : e;
  }

  public int registerCount()
  {
    return m;
  }

  @VisibleForTesting
  byte[] registers()
  {
    return Arrays.copyOf(registers, registers.length);
  }

  @Override
  public long memoryFootprint()
  {
    return registers.length; // not counting object headers, `hashFunction` and `funnel` references
  }

  @Override
  public String name()
  {
    return "hll" + p;
  }
}
