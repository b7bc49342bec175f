package io.streamstat.sketch;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class VisitorDatasetGeneratorTest
{
  @Test
  void testGeneratesRequestedSize()
  {
    List<String> dataset = new VisitorDatasetGenerator(1).generate(10_000);

    assertThat(dataset).hasSize(10_000);
    assertThat(dataset).allMatch(ip -> ip.startsWith("192.168.1.") || ip.startsWith("10.0.") || ip.startsWith("172.16."));
    assertThat(dataset).anyMatch(ip -> ip.startsWith("192.168.1."));
    assertThat(dataset).anyMatch(ip -> ip.startsWith("10.0."));
    assertThat(dataset).anyMatch(ip -> ip.startsWith("172.16."));

    // about 0.39 * elements distinct visitors
    Set<String> distinct = new HashSet<>(dataset);
    assertThat(distinct.size()).isBetween(3_000, 5_000);
  }

  @Test
  void testFrequentVisitorsRepeat()
  {
    List<String> dataset = new VisitorDatasetGenerator(2).generate(30_000);

    long visits = dataset.stream().filter("192.168.1.0"::equals).count();
    assertThat(visits).isBetween(10L, 50L);
  }

  @Test
  void testSameSeedSameDataset()
  {
    assertThat(new VisitorDatasetGenerator(99).generate(2_000))
        .containsExactlyElementsOf(new VisitorDatasetGenerator(99).generate(2_000));
  }

  @Test
  void testEmptyAndTinyDatasets()
  {
    assertThat(new VisitorDatasetGenerator(5).generate(0)).isEmpty();
    assertThat(new VisitorDatasetGenerator(5).generate(3)).hasSize(3);
  }

  @Test
  void testInitialCapacityDoesNotOverflow()
  {
    assertThat(VisitorDatasetGenerator.initialCapacity(1_000)).isEqualTo(1_064);
    assertThat(VisitorDatasetGenerator.initialCapacity(Integer.MAX_VALUE - 10)).isEqualTo(Integer.MAX_VALUE);
    assertThat(VisitorDatasetGenerator.initialCapacity(Integer.MAX_VALUE)).isEqualTo(Integer.MAX_VALUE);
  }
}
