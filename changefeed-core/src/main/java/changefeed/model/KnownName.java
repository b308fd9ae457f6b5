package changefeed.model;

/**
 * Stored naming data for an app or package.
 *
 * @param name          current name, may be empty when the item has never been resolved
 * @param lastKnownName name before the most recent rename, may be {@code null}
 * @param type          app type such as {@code Game} or {@code DLC}; {@code null} for packages
 */
public record KnownName(String name, String lastKnownName, String type) {
}
