package changefeed.spi;

import changefeed.model.BillingType;
import changefeed.model.FeedChange;
import changefeed.model.KnownName;

import java.sql.Connection;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Persistence contract for change history and the catalog tables the pipeline reads.
 *
 * <p>All methods receive an explicit {@link Connection}; the caller owns it. Writes are
 * idempotent: recording a change number or a change row twice is not an error.
 * Implementations live in the {@code changefeed-jdbc} module and signal failures with
 * unchecked exceptions.
 */
public interface ChangeStore {

    /**
     * Returns the highest recorded change number, or {@code 0} when history is empty.
     */
    long maxChangeNumber(Connection conn);

    /**
     * Inserts change numbers into history, ignoring ones already present.
     *
     * @return the number of change numbers submitted
     */
    int upsertChangeNumbers(Connection conn, Collection<Long> changeNumbers);

    /**
     * Records (change number, app) pairs, ignoring duplicates.
     */
    int recordAppChanges(Connection conn, Collection<FeedChange> changes);

    /**
     * Records (change number, package) pairs, ignoring duplicates.
     */
    int recordPackageChanges(Connection conn, Collection<FeedChange> changes);

    /**
     * Sets the last-updated timestamp of the given apps to now.
     *
     * @return rows updated
     */
    int touchApps(Connection conn, Collection<Integer> appIds);

    /**
     * Sets the last-updated timestamp of the given packages to now.
     *
     * @return rows updated
     */
    int touchPackages(Connection conn, Collection<Integer> packageIds);

    /**
     * Returns the known billing type of each given package. Packages without a stored
     * billing type are absent from the result.
     */
    Map<Integer, BillingType> billingTypes(Connection conn, Collection<Integer> packageIds);

    /**
     * Returns the distinct apps contained in the given packages, ascending.
     */
    List<Integer> appsInPackages(Connection conn, Collection<Integer> packageIds);

    Map<Integer, KnownName> appNames(Connection conn, Collection<Integer> appIds);

    Map<Integer, KnownName> packageNames(Connection conn, Collection<Integer> packageIds);

    /**
     * Returns the highest stored app id strictly below {@code below}, or {@code 0}.
     */
    int highestAppId(Connection conn, int below);

    /**
     * Returns the highest stored package id, or {@code 0}.
     */
    int highestPackageId(Connection conn);

    /**
     * Returns all stored app ids together with every app id linked from a package, descending.
     */
    List<Integer> allAppIds(Connection conn);

    /**
     * Returns all stored package ids, descending.
     */
    List<Integer> allPackageIds(Connection conn);
}
