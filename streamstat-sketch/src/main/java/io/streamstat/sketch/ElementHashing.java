package io.streamstat.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.Funnel;
import com.google.common.hash.Funnels;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Hashing shared by the estimators.
 *
 * <p>Elements never reach a hash function through {@code toString()}: every element type is
 * serialized by an explicit {@link Funnel}.
 * <ul>
 *   <li>{@link #STRING_FUNNEL}: the UTF-8 bytes of the string, without a length prefix
 *   <li>{@link #LONG_FUNNEL}: the 8 little-endian bytes of the value
 * </ul>
 */
public final class ElementHashing
{
  public static final Funnel<CharSequence> STRING_FUNNEL = Funnels.stringFunnel(StandardCharsets.UTF_8);
  public static final Funnel<Long> LONG_FUNNEL = Funnels.longFunnel();

  private ElementHashing()
  {
  }

  /**
   * Default hash for rank-register estimators, 128 bits of which the first 64 are used.
   */
  public static HashFunction defaultHash64()
  {
    return Hashing.murmur3_128();
  }

  public static <T> long hash64(HashFunction hashFunction, Funnel<? super T> funnel, T element)
  {
    return hashFunction.hashObject(element, funnel).asLong();
  }

  /**
   * @return {@code k} seeded 32-bits murmur3 functions, the i-th one seeded with {@code i}
   */
  public static HashFunction[] probeFamily(int k)
  {
    Preconditions.checkArgument(k > 0, "invalid hash function count [%s] : should be positive", k);
    HashFunction[] family = new HashFunction[k];
    for (int i = 0; i < k; i++) {
      family[i] = Hashing.murmur3_32_fixed(i);
    }
    return family;
  }

  static void checkHashWidth(HashFunction hashFunction)
  {
    Preconditions.checkArgument(
        hashFunction.bits() >= Long.SIZE,
        "hash function %s produces %s bits : at least 64 bits are needed",
        hashFunction,
        hashFunction.bits()
    );
  }
}
