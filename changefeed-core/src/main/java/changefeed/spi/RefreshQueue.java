package changefeed.spi;

import java.util.Collection;

/**
 * External queue of items whose public store data should be refreshed.
 */
public interface RefreshQueue {

  void enqueueApps(Collection<Integer> appIds);

  void enqueuePackages(Collection<Integer> packageIds);
}
