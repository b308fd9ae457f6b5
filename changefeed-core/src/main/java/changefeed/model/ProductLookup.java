package changefeed.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of looking up a single item's product info.
 *
 * @param info the returned info; present for {@link Status#FOUND} and {@link Status#NO_INFO}
 */
public record ProductLookup(int id, ItemKind kind, Status status, Optional<ProductInfo> info) {

  public enum Status {
    /** The catalog returned key/values for the item. */
    FOUND,
    /** The catalog knows the item but returned no key/values. */
    NO_INFO,
    /** The catalog returned no result for the item. */
    UNKNOWN,
    /** A request failed or timed out. */
    FAILED
  }

  public ProductLookup {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(info, "info");
  }

  public static ProductLookup of(ProductInfo info) {
    Status status = info.keyValues().isEmpty() ? Status.NO_INFO : Status.FOUND;
    return new ProductLookup(info.id(), info.kind(), status, Optional.of(info));
  }

  public static ProductLookup unknown(ItemKind kind, int id) {
    return new ProductLookup(id, kind, Status.UNKNOWN, Optional.empty());
  }

  public static ProductLookup failed(ItemKind kind, int id) {
    return new ProductLookup(id, kind, Status.FAILED, Optional.empty());
  }

  /**
   * Whether the catalog withheld data because no valid token was sent.
   */
  public boolean missingToken() {
    return info.map(ProductInfo::missingToken).orElse(false);
  }
}
