package changefeed.model;

import java.util.Map;
import java.util.Objects;

/**
 * Product-info result for one item. Key/values are passed through unparsed.
 *
 * @param missingToken whether the remote catalog withheld the data because no valid token was sent
 */
public record ProductInfo(int id, ItemKind kind, boolean missingToken, Map<String, String> keyValues) {

  public ProductInfo {
    Objects.requireNonNull(kind, "kind");
    keyValues = Map.copyOf(Objects.requireNonNull(keyValues, "keyValues"));
  }
}
