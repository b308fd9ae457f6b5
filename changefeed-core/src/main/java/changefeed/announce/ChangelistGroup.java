package changefeed.announce;

import changefeed.model.FeedChange;
import changefeed.model.FeedResponse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * App and package ids of one response that share a change number.
 */
public final class ChangelistGroup {
  private final long changeNumber;
  private final List<Integer> apps = new ArrayList<>();
  private final List<Integer> packages = new ArrayList<>();

  ChangelistGroup(long changeNumber) {
    this.changeNumber = changeNumber;
  }

  /**
   * Groups the changes of {@code response} by change number, ascending.
   */
  public static SortedMap<Long, ChangelistGroup> groupBy(FeedResponse response) {
    SortedMap<Long, ChangelistGroup> groups = new TreeMap<>();
    for (FeedChange app : response.appChanges().values()) {
      groups.computeIfAbsent(app.changeNumber(), ChangelistGroup::new).apps.add(app.id());
    }
    for (FeedChange pkg : response.packageChanges().values()) {
      groups.computeIfAbsent(pkg.changeNumber(), ChangelistGroup::new).packages.add(pkg.id());
    }
    return groups;
  }

  public long changeNumber() {
    return changeNumber;
  }

  public List<Integer> apps() {
    return Collections.unmodifiableList(apps);
  }

  public List<Integer> packages() {
    return Collections.unmodifiableList(packages);
  }

  public int size() {
    return apps.size() + packages.size();
  }
}
