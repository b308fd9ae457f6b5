package changefeed.resync;

import java.util.List;
import java.util.Objects;

/**
 * Identifier lists a full resync will dispatch, in dispatch order.
 */
public record ResyncPlan(List<Integer> apps, List<Integer> packages) {

  public ResyncPlan {
    apps = List.copyOf(Objects.requireNonNull(apps, "apps"));
    packages = List.copyOf(Objects.requireNonNull(packages, "packages"));
  }
}
