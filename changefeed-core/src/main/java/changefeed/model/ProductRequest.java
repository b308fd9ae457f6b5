package changefeed.model;

import java.util.Objects;

/**
 * Product-info request for one item, optionally carrying its access token.
 *
 * @param token the access token, or {@code 0} when none is known
 */
public record ProductRequest(int id, ItemKind kind, long token) {

  public ProductRequest {
    Objects.requireNonNull(kind, "kind");
  }

  public boolean hasToken() {
    return token != 0L;
  }
}
