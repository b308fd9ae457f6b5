package changefeed.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Splits lists into ordered, bounded chunks.
 */
public final class Partitions {

  private Partitions() {}

  /**
   * Splits {@code items} into consecutive chunks of at most {@code size} elements, preserving
   * iteration order. The last chunk holds the remainder. An empty input yields no chunks.
   */
  public static <T> List<List<T>> partition(Collection<T> items, int size) {
    Objects.requireNonNull(items, "items");
    if (size <= 0) {
      throw new IllegalArgumentException("size must be > 0");
    }
    List<T> source = new ArrayList<>(items);
    List<List<T>> chunks = new ArrayList<>((source.size() + size - 1) / size);
    for (int from = 0; from < source.size(); from += size) {
      chunks.add(List.copyOf(source.subList(from, Math.min(from + size, source.size()))));
    }
    return chunks;
  }

  /**
   * Returns {@code count} integers counting down from {@code count - 1} to {@code 0}.
   */
  public static List<Integer> descendingRange(int count) {
    if (count < 0) {
      throw new IllegalArgumentException("count must be >= 0");
    }
    List<Integer> ids = new ArrayList<>(count);
    for (int i = count - 1; i >= 0; i--) {
      ids.add(i);
    }
    return ids;
  }
}
