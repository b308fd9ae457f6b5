package changefeed.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Result of one "changes since N" request: the feed's current change number plus the apps
 * and packages that changed since N, keyed by identifier in the order the feed reported them.
 *
 * <p>Instances are immutable.
 */
public final class FeedResponse {
  private final long currentChangeNumber;
  private final Map<Integer, FeedChange> appChanges;
  private final Map<Integer, FeedChange> packageChanges;

  public FeedResponse(long currentChangeNumber,
      Map<Integer, FeedChange> appChanges,
      Map<Integer, FeedChange> packageChanges) {
    if (currentChangeNumber < 0) {
      throw new IllegalArgumentException("currentChangeNumber must be >= 0");
    }
    this.currentChangeNumber = currentChangeNumber;
    this.appChanges = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(appChanges, "appChanges")));
    this.packageChanges = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(packageChanges, "packageChanges")));
  }

  public static Builder builder(long currentChangeNumber) {
    return new Builder(currentChangeNumber);
  }

  public long currentChangeNumber() {
    return currentChangeNumber;
  }

  public Map<Integer, FeedChange> appChanges() {
    return appChanges;
  }

  public Map<Integer, FeedChange> packageChanges() {
    return packageChanges;
  }

  public List<Integer> appIds() {
    return new ArrayList<>(appChanges.keySet());
  }

  public List<Integer> packageIds() {
    return new ArrayList<>(packageChanges.keySet());
  }

  public boolean isEmpty() {
    return appChanges.isEmpty() && packageChanges.isEmpty();
  }

  /**
   * Every distinct change number referenced by an item, followed by this response's own
   * change number (listed once).
   */
  public List<Long> referencedChangeNumbers() {
    Set<Long> numbers = new LinkedHashSet<>();
    for (FeedChange change : appChanges.values()) {
      numbers.add(change.changeNumber());
    }
    for (FeedChange change : packageChanges.values()) {
      numbers.add(change.changeNumber());
    }
    numbers.remove(currentChangeNumber);
    List<Long> result = new ArrayList<>(numbers);
    result.add(currentChangeNumber);
    return result;
  }

  @Override
  public String toString() {
    return "FeedResponse{changeNumber=" + currentChangeNumber
        + ", apps=" + appChanges.size() + ", packages=" + packageChanges.size() + "}";
  }

  /** Builder for {@link FeedResponse}, mainly for feed clients and tests. */
  public static final class Builder {
    private final long currentChangeNumber;
    private final Map<Integer, FeedChange> apps = new LinkedHashMap<>();
    private final Map<Integer, FeedChange> packages = new LinkedHashMap<>();

    private Builder(long currentChangeNumber) {
      this.currentChangeNumber = currentChangeNumber;
    }

    public Builder app(int id, long changeNumber) {
      return change(FeedChange.app(id, changeNumber));
    }

    public Builder pkg(int id, long changeNumber) {
      return change(FeedChange.pkg(id, changeNumber));
    }

    public Builder change(FeedChange change) {
      Objects.requireNonNull(change, "change");
      if (change.kind() == ItemKind.APP) {
        apps.put(change.id(), change);
      } else {
        packages.put(change.id(), change);
      }
      return this;
    }

    public FeedResponse build() {
      return new FeedResponse(currentChangeNumber, apps, packages);
    }
  }
}
