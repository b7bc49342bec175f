package io.streamstat.sketch;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Generates a synthetic log of visitor IPs with three frequency patterns.
 * <ul>
 *   <li>20% of the elements come from frequent visitors, 10-50 visits each, {@code 192.168.1.<i>}
 *   <li>30% of the elements come from occasional visitors, 3-9 visits each, {@code 10.0.<i/256>.<i%256>}
 *   <li>the rest come from rare visitors, 1-2 visits each, {@code 172.16.<i/256>.<i%256>}
 * </ul>
 *
 * <p>That gives about {@code 0.39 * elements} distinct IPs with an average frequency around 2.56.
 * The result is trimmed to exactly {@code elements} entries and shuffled.
 */
public class VisitorDatasetGenerator
{
  private final Random random;

  public VisitorDatasetGenerator()
  {
    this(new Random().nextLong());
  }

  public VisitorDatasetGenerator(long seed)
  {
    this.random = new Random(seed);
  }

  public List<String> generate(int elements)
  {
    Preconditions.checkArgument(elements >= 0, "invalid element count [%s] : should not be negative", elements);
    List<String> dataset = new ArrayList<>(initialCapacity(elements));

    final int frequentVisitors = (int) (elements * 0.20) / 30;
    for (int i = 0; i < frequentVisitors; i++) {
      repeat(dataset, "192.168.1." + i, randomInclusive(10, 50));
    }

    final int occasionalVisitors = (int) (elements * 0.30) / 6;
    for (int i = 0; i < occasionalVisitors; i++) {
      repeat(dataset, "10.0." + (i / 256) + "." + (i % 256), randomInclusive(3, 9));
    }

    final int rareVisitors = elements - dataset.size();
    for (int i = 0; i < rareVisitors; i++) {
      repeat(dataset, "172.16." + (i / 256) + "." + (i % 256), randomInclusive(1, 2));
    }

    List<String> trimmed = dataset.size() > elements ? new ArrayList<>(dataset.subList(0, elements)) : dataset;
    Collections.shuffle(trimmed, random);
    return trimmed;
  }

  @VisibleForTesting
  static int initialCapacity(int elements)
  {
    return Ints.saturatedCast((long) elements + 64);
  }

  private int randomInclusive(int from, int to)
  {
    return from + random.nextInt(to - from + 1);
  }

  private static void repeat(List<String> dataset, String ip, int visits)
  {
    for (int v = 0; v < visits; v++) {
      dataset.add(ip);
    }
  }
}
