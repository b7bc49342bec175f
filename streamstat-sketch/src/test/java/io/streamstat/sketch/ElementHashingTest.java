package io.streamstat.sketch;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ElementHashingTest
{
  @Test
  void testStringsHashAsUtf8Bytes()
  {
    HashFunction hashFunction = ElementHashing.defaultHash64();
    String element = "café-10.0.0.1";

    long hash = ElementHashing.hash64(hashFunction, ElementHashing.STRING_FUNNEL, element);

    assertThat(hash).isEqualTo(hashFunction.hashBytes(element.getBytes(StandardCharsets.UTF_8)).asLong());
    assertThat(hash).isEqualTo(ElementHashing.hash64(hashFunction, ElementHashing.STRING_FUNNEL, element));
  }

  @Test
  void testLongsHashAsLittleEndianBytes()
  {
    HashFunction hashFunction = ElementHashing.defaultHash64();
    byte[] bytes = ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(12345L).array();

    assertThat(ElementHashing.hash64(hashFunction, ElementHashing.LONG_FUNNEL, 12345L))
        .isEqualTo(hashFunction.hashBytes(bytes).asLong());
  }

  @Test
  void testProbeFamilyIsSeededByIndex()
  {
    HashFunction[] family = ElementHashing.probeFamily(10);

    assertThat(family).hasSize(10);
    Set<Integer> hashes = new HashSet<>();
    for (int i = 0; i < family.length; i++) {
      int hash = family[i].hashObject("192.168.1.1", ElementHashing.STRING_FUNNEL).asInt();
      assertThat(hash).isEqualTo(Hashing.murmur3_32_fixed(i).hashString("192.168.1.1", StandardCharsets.UTF_8).asInt());
      hashes.add(hash);
    }
    assertThat(hashes).hasSize(10);
  }

  @Test
  void testProbeFamilyNeedsPositiveSize()
  {
    assertThatThrownBy(() -> ElementHashing.probeFamily(0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testHashWidth()
  {
    ElementHashing.checkHashWidth(Hashing.murmur3_128());
    ElementHashing.checkHashWidth(Hashing.sha256());
    assertThatThrownBy(() -> ElementHashing.checkHashWidth(Hashing.crc32()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
