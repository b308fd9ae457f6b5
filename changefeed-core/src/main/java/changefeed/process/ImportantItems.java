package changefeed.process;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Allow-list of apps and packages whose changes get a dedicated announcement.
 */
public final class ImportantItems {
  public static final ImportantItems NONE = new ImportantItems(Set.of(), Set.of());

  private final Set<Integer> apps;
  private final Set<Integer> packages;

  public ImportantItems(Collection<Integer> apps, Collection<Integer> packages) {
    this.apps = Collections.unmodifiableSet(new LinkedHashSet<>(apps));
    this.packages = Collections.unmodifiableSet(new LinkedHashSet<>(packages));
  }

  /**
   * Returns the ids of {@code changedApps} on the allow-list, in their original order.
   */
  public List<Integer> importantApps(Collection<Integer> changedApps) {
    return changedApps.stream().filter(apps::contains).collect(Collectors.toList());
  }

  /**
   * Returns the ids of {@code changedPackages} on the allow-list, in their original order.
   */
  public List<Integer> importantPackages(Collection<Integer> changedPackages) {
    return changedPackages.stream().filter(packages::contains).collect(Collectors.toList());
  }
}
